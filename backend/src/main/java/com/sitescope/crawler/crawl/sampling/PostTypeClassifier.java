package com.sitescope.crawler.crawl.sampling;

import com.sitescope.crawler.crawl.util.UrlIdentity;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic post-type labels used only for sampling. Path rules are evaluated top to bottom,
 * then title keywords, then a depth default.
 */
public final class PostTypeClassifier {
    private static final List<PathRule> PATH_RULES = List.of(
        new PathRule(Pattern.compile("/(blog|post|article|news)/.*\\d{4}"), PostType.BLOG_POST),
        new PathRule(Pattern.compile("/\\d{4}/\\d{2}/\\d{2}/"), PostType.BLOG_POST),
        new PathRule(Pattern.compile("/(blog|post|article|news)/"), PostType.BLOG_POST),
        new PathRule(Pattern.compile("/(product|item|shop)/"), PostType.PRODUCT),
        new PathRule(Pattern.compile("/p/|/products/"), PostType.PRODUCT),
        new PathRule(Pattern.compile("/(category|tag|archive|topics)/"), PostType.CATEGORY),
        new PathRule(Pattern.compile("/cat/|/tags/"), PostType.CATEGORY),
        new PathRule(Pattern.compile("/(services|solutions|features)/"), PostType.SERVICE),
        new PathRule(Pattern.compile("/(about|company|team|contact)/"), PostType.ABOUT),
        new PathRule(Pattern.compile("/(docs|help|support|faq|guide)/"), PostType.DOCUMENTATION)
    );

    private static final List<TitleRule> TITLE_RULES = List.of(
        new TitleRule(List.of("blog", "post", "article"), PostType.BLOG_POST),
        new TitleRule(List.of("product", "buy", "price"), PostType.PRODUCT),
        new TitleRule(List.of("category", "archive"), PostType.CATEGORY)
    );

    private PostTypeClassifier() {
    }

    public static PostType classify(String url) {
        return classify(url, null);
    }

    public static PostType classify(String url, String pageTitle) {
        URI uri = UrlIdentity.safeUri(url);
        if (uri == null) {
            return PostType.OTHER;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);

        for (PathRule rule : PATH_RULES) {
            if (rule.pattern().matcher(path).find()) {
                return rule.type();
            }
        }
        if (path.isEmpty() || "/".equals(path)) {
            return PostType.HOMEPAGE;
        }

        if (pageTitle != null && !pageTitle.isBlank()) {
            String title = pageTitle.toLowerCase(Locale.ROOT);
            for (TitleRule rule : TITLE_RULES) {
                if (rule.keywords().stream().anyMatch(title::contains)) {
                    return rule.type();
                }
            }
        }

        int segments = SampledCrawlPolicy.urlLevel(url);
        if (segments == 0) {
            return PostType.HOMEPAGE;
        }
        if (segments == 1) {
            return PostType.SECTION;
        }
        return segments >= 2 ? PostType.CONTENT : PostType.OTHER;
    }

    private record PathRule(Pattern pattern, PostType type) {
    }

    private record TitleRule(List<String> keywords, PostType type) {
    }
}
