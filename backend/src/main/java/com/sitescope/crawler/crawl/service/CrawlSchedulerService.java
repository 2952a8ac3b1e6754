package com.sitescope.crawler.crawl.service;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.model.SchedulerStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-interval timer driving {@link CrawlJobProcessor#pollAndProcess()}. The first tick runs
 * immediately on start. Stopping cancels future ticks but never interrupts a tick in progress.
 */
@Service
public class CrawlSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(CrawlSchedulerService.class);

    private final CrawlJobProcessor processor;
    private final CrawlerProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService executor;
    private volatile Instant lastTickAt;

    public CrawlSchedulerService(CrawlJobProcessor processor, CrawlerProperties properties) {
        this.processor = processor;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public SchedulerStatusResponse getStatus() {
        return new SchedulerStatusResponse(
            running.get(),
            processor.isInFlight(),
            processor.currentJobId(),
            properties.getScheduler().getPollIntervalMs(),
            lastTickAt
        );
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int pollIntervalMs = properties.getScheduler().getPollIntervalMs();
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.scheduleWithFixedDelay(this::tick, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
            log.info("Crawl scheduler started pollIntervalMs={}", pollIntervalMs);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                // no interrupt: an in-flight job runs to the end of its render run
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.info("Crawl scheduler stopping, jobId={} still in flight", processor.currentJobId());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Crawl scheduler stopped");
        }
    }

    /**
     * Runs a tick now instead of waiting for the next interval.
     */
    public void pollNow() {
        synchronized (lifecycleLock) {
            if (!running.get() || executor == null) {
                throw new SchedulerStateException("scheduler_stopped", "Scheduler is not running");
            }
            if (processor.isInFlight()) {
                throw new SchedulerStateException(
                    "job_in_flight",
                    "Crawl job " + processor.currentJobId() + " is still being processed"
                );
            }
            executor.execute(this::tick);
        }
    }

    void tick() {
        lastTickAt = Instant.now();
        try {
            processor.pollAndProcess();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the periodic task
            log.warn("Scheduler tick failed", e);
        }
    }
}
