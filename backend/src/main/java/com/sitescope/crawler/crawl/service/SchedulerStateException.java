package com.sitescope.crawler.crawl.service;

/**
 * Operator request the scheduler cannot honour in its current state.
 */
public class SchedulerStateException extends RuntimeException {
    private final String code;

    public SchedulerStateException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
