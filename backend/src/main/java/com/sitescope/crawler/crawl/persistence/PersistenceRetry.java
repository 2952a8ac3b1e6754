package com.sitescope.crawler.crawl.persistence;

import com.sitescope.crawler.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded retry around store calls made during a crawl. Waits {@code attempt x backoff}
 * between attempts and checks the connection before retrying. Integrity violations are
 * rethrown at once.
 */
@Component
public class PersistenceRetry {
    private static final Logger log = LoggerFactory.getLogger(PersistenceRetry.class);

    private final CrawlerProperties properties;
    private final CrawlJobRepository jobRepository;

    public PersistenceRetry(CrawlerProperties properties, CrawlJobRepository jobRepository) {
        this.properties = properties;
        this.jobRepository = jobRepository;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int maxAttempts = properties.getPersistence().getMaxAttempts();
        DataAccessException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                reconnect(operation, attempt);
            }
            try {
                return action.get();
            } catch (DataIntegrityViolationException e) {
                throw e;
            } catch (DataAccessException e) {
                lastError = e;
                log.warn("{} failed attempt={}/{}: {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !sleep(attempt)) {
                    break;
                }
            }
        }
        throw new CrawlPersistenceException(operation, lastError);
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private void reconnect(String operation, int attempt) {
        try {
            if (jobRepository.isDbReachable()) {
                log.info("Store reachable again before {} attempt={}", operation, attempt);
            }
        } catch (DataAccessException e) {
            log.warn("Store still unreachable before {} attempt={}: {}", operation, attempt, e.getMessage());
        }
    }

    private boolean sleep(int attempt) {
        long delayMs = properties.getPersistence().getBackoffMs() * attempt;
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
