package com.sitescope.crawler.crawl.model;

/**
 * An anchor found on a fetched page, resolved against the page URL.
 */
public record LinkCandidate(
    String href,
    String anchorText,
    String altText,
    String rel,
    String target,
    boolean follow,
    int position,
    String origin
) {
}
