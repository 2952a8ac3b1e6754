package com.sitescope.crawler.crawl.model;

import java.time.Instant;

public record CrawlJob(
    String id,
    String url,
    int maxPages,
    boolean takeScreenshots,
    boolean crawlSitemap,
    boolean sampledCrawl,
    boolean ignoreUrlParameters,
    boolean emailVerificationRequired,
    String email,
    CrawlJobStatus status,
    boolean canContinue,
    int pagesCrawled,
    int pagesRemaining,
    int totalUniquePagesFound,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String lastCrawledUrl,
    String errorMessage
) {
    public int remainingBudget() {
        return Math.max(0, maxPages - pagesCrawled);
    }
}
