package com.sitescope.crawler.crawl.model;

public record CrawlJobRequest(
    String url,
    int maxPages,
    boolean takeScreenshots,
    boolean crawlSitemap,
    boolean sampledCrawl,
    boolean ignoreUrlParameters,
    boolean emailVerificationRequired,
    String email
) {
    public static CrawlJobRequest of(String url, int maxPages) {
        return new CrawlJobRequest(url, maxPages, false, true, false, false, false, null);
    }
}
