package com.sitescope.crawler.crawl.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out to the completion notifiers. Failures are logged and never reach
 * the caller.
 */
@Service
public class CompletionNotificationService {
    private static final Logger log = LoggerFactory.getLogger(CompletionNotificationService.class);

    private final List<JobCompletionNotifier> notifiers;
    private final ExecutorService executor;

    public CompletionNotificationService(
        List<JobCompletionNotifier> notifiers,
        @Qualifier("notificationExecutor") ExecutorService executor
    ) {
        this.notifiers = notifiers;
        this.executor = executor;
    }

    public List<Future<?>> dispatch(String jobId) {
        List<Future<?>> submitted = new ArrayList<>();
        for (JobCompletionNotifier notifier : notifiers) {
            if (!notifier.isEnabled()) {
                log.debug("Notifier {} disabled, skipping jobId={}", notifier.name(), jobId);
                continue;
            }
            try {
                submitted.add(executor.submit(() -> deliver(notifier, jobId)));
            } catch (RejectedExecutionException e) {
                log.warn("Notifier {} rejected jobId={}", notifier.name(), jobId, e);
            }
        }
        return submitted;
    }

    private void deliver(JobCompletionNotifier notifier, String jobId) {
        try {
            notifier.notifyCompleted(jobId);
        } catch (RuntimeException e) {
            log.warn("Notifier {} failed jobId={}: {}", notifier.name(), jobId, e.getMessage());
        }
    }
}
