package com.sitescope.crawler.crawl.model;

public record PageLinkMetrics(
    long pageId,
    int inlinks,
    int uniqueInlinks,
    int outlinks,
    int uniqueOutlinks,
    int externalOutlinks,
    int uniqueExternalOutlinks,
    double linkScore,
    double percentOfTotal
) {
}
