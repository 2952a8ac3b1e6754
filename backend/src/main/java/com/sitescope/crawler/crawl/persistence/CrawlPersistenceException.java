package com.sitescope.crawler.crawl.persistence;

/**
 * A store operation kept failing after its retries. Fails the job that was being processed.
 */
public class CrawlPersistenceException extends RuntimeException {
    private final String operation;

    public CrawlPersistenceException(String operation, Throwable cause) {
        super(operation + " failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
