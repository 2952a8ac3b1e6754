package com.sitescope.crawler.crawl.model;

import java.util.List;

/**
 * One fetched sitemap document. {@code id} and {@code parentId} are positions in the
 * discovery arena, not database keys.
 */
public record SitemapRecord(
    int id,
    Integer parentId,
    String url,
    SitemapProvenance provenance,
    SitemapKind kind,
    String content,
    Integer statusCode,
    long responseTimeMs,
    List<SitemapUrlEntry> urls,
    List<String> childSitemapUrls,
    String lastmod,
    String changefreq,
    Double priority,
    String errorMessage
) {
    public int urlCount() {
        return urls == null ? 0 : urls.size();
    }

    public boolean isIndex() {
        return kind == SitemapKind.INDEX;
    }
}
