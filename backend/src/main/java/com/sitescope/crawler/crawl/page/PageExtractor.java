package com.sitescope.crawler.crawl.page;

import com.sitescope.crawler.crawl.model.PageData;
import com.sitescope.crawler.crawl.render.RenderedPage;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Builds the stored page record from a rendered page: SEO tags, headings and the metrics in
 * {@link PageMetrics}. Link-graph fields are filled later, when the job is finalized.
 */
@Component
public class PageExtractor {
    private static final String DEFAULT_CONTENT_TYPE = "text/html";

    public PageData extract(RenderedPage page, String address, String jobUrl) {
        Document document = page.document() != null
            ? page.document()
            : Jsoup.parse(page.html() == null ? "" : page.html(), page.urlForProcessing());

        String html = document.outerHtml();
        Element body = document.body();
        String text = body == null ? null : body.text();
        PageMetrics.TextStats stats = PageMetrics.analyzeText(text);

        int sizeBytes = html.getBytes(StandardCharsets.UTF_8).length;
        int statusCode = page.statusCode() > 0 ? page.statusCode() : 200;
        String contentType = page.header("Content-Type");
        String metaRobots = metaContent(document, "robots");
        List<String> h1Tags = headings(document, "h1");
        long responseTimeMs = page.responseTime() == null ? 0 : page.responseTime().toMillis();

        return new PageData(
            address,
            statusCode,
            PageMetrics.statusText(statusCode),
            contentType == null ? DEFAULT_CONTENT_TYPE : contentType,
            indexability(metaRobots, page.header("X-Robots-Tag")),
            blankToNull(document.title()),
            metaContent(document, "description"),
            metaContent(document, "keywords"),
            metaRobots,
            h1Tags.isEmpty() ? null : h1Tags.get(0),
            headings(document, "h2"),
            headings(document, "h3"),
            linkHref(document, "canonical"),
            linkHref(document, "next"),
            linkHref(document, "prev"),
            linkHref(document, "amphtml"),
            linkHref(document, "alternate"),
            language(document),
            document.select("a[href]").size(),
            document.select("img").size(),
            sizeBytes,
            sizeBytes,
            PageMetrics.co2Mg(sizeBytes),
            PageMetrics.carbonRating(sizeBytes),
            responseTimeMs,
            stats.wordCount(),
            stats.sentenceCount(),
            stats.avgWordsPerSentence(),
            stats.fleschReadingEaseScore(),
            PageMetrics.readabilityLabel(stats.fleschReadingEaseScore()),
            PageMetrics.textRatio(text, html),
            crawlDepth(address, jobUrl),
            folderDepth(address),
            parseHttpDate(page.header("Last-Modified")),
            joinOrNull(page.headerValues("Set-Cookie")),
            encodeUriComponent(address),
            html,
            null
        );
    }

    static String indexability(String metaRobots, String xRobotsTag) {
        boolean noindex = containsNoindex(metaRobots) || containsNoindex(xRobotsTag);
        return noindex ? "Non-Indexable" : "Indexable";
    }

    /**
     * Path segments beyond the job URL's own; the job URL itself is depth 0.
     */
    static int crawlDepth(String address, String jobUrl) {
        if (address == null || address.equals(jobUrl)) {
            return 0;
        }
        int depth = UrlIdentity.pathDepth(address);
        int base = UrlIdentity.pathDepth(jobUrl);
        if (depth < 0 || base < 0) {
            return 0;
        }
        return Math.max(0, depth - base);
    }

    static int folderDepth(String address) {
        return Math.max(0, UrlIdentity.pathDepth(address));
    }

    static String encodeUriComponent(String value) {
        if (value == null) {
            return null;
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%21", "!")
            .replace("%27", "'")
            .replace("%28", "(")
            .replace("%29", ")")
            .replace("%7E", "~");
    }

    private static Instant parseHttpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String metaContent(Document document, String name) {
        Element meta = document.selectFirst("meta[name=" + name + "], meta[property=" + name + "]");
        return meta == null ? null : blankToNull(meta.attr("content"));
    }

    private static String language(Document document) {
        Element root = document.selectFirst("html");
        return root == null ? null : blankToNull(root.attr("lang"));
    }

    private static String linkHref(Document document, String rel) {
        Element link = document.selectFirst("link[rel=" + rel + "]");
        return link == null ? null : blankToNull(link.attr("href"));
    }

    private static List<String> headings(Document document, String tag) {
        return document.select(tag).stream()
            .map(element -> element.text().trim())
            .filter(text -> !text.isEmpty())
            .toList();
    }

    private static boolean containsNoindex(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).contains("noindex");
    }

    private static String joinOrNull(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join("\n", values);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
