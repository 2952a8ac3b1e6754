package com.sitescope.crawler.crawl.page;

import com.sitescope.crawler.crawl.model.LinkCandidate;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class LinkExtractor {
    static final String ORIGIN_HTML = "html";

    /**
     * Every {@code a[href]} in document order, resolved against the document base URI.
     * Hrefs jsoup cannot resolve but that carry their own scheme ({@code tel:}) are kept
     * as written. Positions count all anchors, including ones that could not be resolved.
     */
    public List<LinkCandidate> extract(Document document) {
        if (document == null) {
            return List.of();
        }
        Elements anchors = document.select("a[href]");
        List<LinkCandidate> links = new ArrayList<>(anchors.size());
        int position = 0;
        for (Element anchor : anchors) {
            position++;
            String href = anchor.absUrl("href");
            if (href == null || href.isBlank()) {
                String raw = anchor.attr("href").trim();
                if (!UrlIdentity.hasScheme(raw)) {
                    continue;
                }
                href = raw;
            }
            Element image = anchor.selectFirst("img");
            String rel = blankToNull(anchor.attr("rel"));
            links.add(new LinkCandidate(
                href,
                anchor.text().trim(),
                image == null ? null : blankToNull(image.attr("alt")),
                rel,
                blankToNull(anchor.attr("target")),
                rel == null || !rel.toLowerCase(Locale.ROOT).contains("nofollow"),
                position,
                ORIGIN_HTML
            ));
        }
        return links;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
