package com.sitescope.crawler.crawl.notify;

/**
 * Collaborator told about a completed crawl job. Implementations own their own retries.
 */
public interface JobCompletionNotifier {

    String name();

    boolean isEnabled();

    void notifyCompleted(String jobId);
}
