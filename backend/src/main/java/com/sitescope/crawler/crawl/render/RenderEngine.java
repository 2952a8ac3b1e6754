package com.sitescope.crawler.crawl.render;

import java.util.List;

/**
 * Fetches pages starting from {@code seeds} and hands each one to a page handler, which may
 * extend the frontier. The run ends when the frontier is exhausted or
 * {@link RenderOptions#maxRequests()} requests have been handled.
 */
public interface RenderEngine {

    /**
     * Runs synchronously. Per-URL fetch failures go to {@code failureHandler} and do not stop
     * the run; an exception thrown by {@code pageHandler} ends the run and propagates.
     */
    void run(List<String> seeds, RenderOptions options, PageHandler pageHandler, FailureHandler failureHandler);

    @FunctionalInterface
    interface PageHandler {
        void handle(RenderedPage page, Frontier frontier);
    }

    @FunctionalInterface
    interface FailureHandler {
        void onFailure(String url, String reason);
    }
}
