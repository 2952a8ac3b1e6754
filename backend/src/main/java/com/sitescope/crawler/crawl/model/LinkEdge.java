package com.sitescope.crawler.crawl.model;

public record LinkEdge(
    long id,
    LinkType type,
    Long fromPageId,
    Long toPageId,
    Long toExternalLinkId,
    String fromAddress,
    String toAddress
) {
}
