package com.sitescope.crawler.crawl.model;

import java.time.Instant;

public record SchedulerStatusResponse(
    boolean running,
    boolean jobInFlight,
    String currentJobId,
    int pollIntervalMs,
    Instant lastTickAt
) {
}
