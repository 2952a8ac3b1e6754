package com.sitescope.crawler.crawl.model;

import java.util.Locale;

public enum LinkType {
    INTERNAL,
    EXTERNAL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LinkType fromDbValue(String raw) {
        return LinkType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
