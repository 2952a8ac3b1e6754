package com.sitescope.crawler.crawl.sitemap;

import com.sitescope.crawler.crawl.model.SitemapKind;
import com.sitescope.crawler.crawl.model.SitemapUrlEntry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient sitemap reader. {@code <sitemap>} blocks make the document an index, otherwise
 * {@code <url>} blocks make it a urlset. Blocks without a {@code <loc>} are skipped.
 */
public final class SitemapParser {

    private SitemapParser() {
    }

    public static ParsedSitemap parse(String xml) {
        if (xml == null || xml.isBlank()) {
            return ParsedSitemap.empty();
        }
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());

        List<Element> sitemapBlocks = doc.select("sitemap");
        if (!sitemapBlocks.isEmpty() || !doc.select("sitemapindex").isEmpty()) {
            List<String> children = new ArrayList<>();
            String lastmod = null;
            for (Element block : sitemapBlocks) {
                String loc = childText(block, "loc");
                if (loc == null) {
                    continue;
                }
                children.add(loc);
                if (lastmod == null) {
                    lastmod = childText(block, "lastmod");
                }
            }
            return new ParsedSitemap(SitemapKind.INDEX, List.of(), children, lastmod, null, null);
        }

        List<Element> urlBlocks = doc.select("url");
        if (urlBlocks.isEmpty()) {
            return ParsedSitemap.empty();
        }
        List<SitemapUrlEntry> entries = new ArrayList<>();
        String firstLastmod = null;
        String firstChangefreq = null;
        Double firstPriority = null;
        for (Element block : urlBlocks) {
            String loc = childText(block, "loc");
            if (loc == null) {
                continue;
            }
            String lastmod = childText(block, "lastmod");
            String changefreq = childText(block, "changefreq");
            Double priority = parsePriority(childText(block, "priority"));
            entries.add(new SitemapUrlEntry(loc, lastmod, changefreq, priority));
            if (firstLastmod == null) {
                firstLastmod = lastmod;
            }
            if (firstChangefreq == null) {
                firstChangefreq = changefreq;
            }
            if (firstPriority == null) {
                firstPriority = priority;
            }
        }
        return new ParsedSitemap(SitemapKind.URLSET, entries, List.of(), firstLastmod, firstChangefreq, firstPriority);
    }

    private static String childText(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (tagName.equals(child.normalName())) {
                String text = child.text().trim();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    private static Double parsePriority(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw);
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public record ParsedSitemap(
        SitemapKind kind,
        List<SitemapUrlEntry> urls,
        List<String> childSitemapUrls,
        String lastmod,
        String changefreq,
        Double priority
    ) {
        static ParsedSitemap empty() {
            return new ParsedSitemap(SitemapKind.UNKNOWN, List.of(), List.of(), null, null, null);
        }
    }
}
