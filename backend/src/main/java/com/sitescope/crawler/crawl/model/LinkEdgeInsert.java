package com.sitescope.crawler.crawl.model;

/**
 * An edge about to be stored. {@code toExternalLinkId} is set for external edges only.
 */
public record LinkEdgeInsert(
    LinkType type,
    long fromPageId,
    Long toExternalLinkId,
    String fromAddress,
    String toAddress,
    LinkCandidate link
) {
}
