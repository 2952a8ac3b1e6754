package com.sitescope.crawler.crawl.model;

import java.util.Locale;

public enum CrawlJobStatus {
    PENDING,
    WAITING_VERIFICATION,
    RUNNING,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static CrawlJobStatus fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return CrawlJobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
