package com.sitescope.crawler.crawl.model;

public record PageRef(long id, String address) {
}
