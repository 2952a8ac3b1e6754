package com.sitescope.crawler.crawl.model;

/**
 * How a sitemap came to be fetched.
 */
public enum SitemapProvenance {
    ROBOTS_TXT("robots-txt"),
    WELL_KNOWN_PATH("well-known-path"),
    SITEMAP_INDEX("sitemap-index");

    private final String dbValue;

    SitemapProvenance(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }
}
