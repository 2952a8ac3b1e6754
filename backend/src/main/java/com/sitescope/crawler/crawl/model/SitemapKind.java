package com.sitescope.crawler.crawl.model;

import java.util.Locale;

public enum SitemapKind {
    INDEX,
    URLSET,
    UNKNOWN;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
