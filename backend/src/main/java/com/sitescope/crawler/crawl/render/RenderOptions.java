package com.sitescope.crawler.crawl.render;

import java.time.Duration;

public record RenderOptions(int maxRequests, Duration navigationTimeout, int maxPageBytes, boolean captureScreenshots) {
}
