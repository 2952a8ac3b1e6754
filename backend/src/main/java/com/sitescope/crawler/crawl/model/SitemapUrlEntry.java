package com.sitescope.crawler.crawl.model;

public record SitemapUrlEntry(String loc, String lastmod, String changefreq, Double priority) {
}
