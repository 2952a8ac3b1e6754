package com.sitescope.crawler.crawl.model;

import com.sitescope.crawler.crawl.robots.RobotsDirectives;

import java.util.List;

public record RobotsResult(
    String url,
    String content,
    Integer statusCode,
    long responseTimeMs,
    RobotsDirectives directives,
    String errorMessage
) {
    public List<String> sitemapUrls() {
        return directives == null ? List.of() : directives.getSitemapUrls();
    }

    public boolean isAvailable() {
        return content != null;
    }

    public static RobotsResult unavailable(String url, Integer statusCode, long responseTimeMs, String errorMessage) {
        return new RobotsResult(url, null, statusCode, responseTimeMs, RobotsDirectives.empty(), errorMessage);
    }
}
