package com.sitescope.crawler.crawl.service;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.links.LinkGraphService;
import com.sitescope.crawler.crawl.model.CrawlJob;
import com.sitescope.crawler.crawl.model.RobotsResult;
import com.sitescope.crawler.crawl.model.SitemapRecord;
import com.sitescope.crawler.crawl.notify.CompletionNotificationService;
import com.sitescope.crawler.crawl.persistence.CrawlJdbcRepository;
import com.sitescope.crawler.crawl.persistence.CrawlJobRepository;
import com.sitescope.crawler.crawl.persistence.PersistenceRetry;
import com.sitescope.crawler.crawl.render.RenderEngine;
import com.sitescope.crawler.crawl.render.RenderOptions;
import com.sitescope.crawler.crawl.robots.RobotsTxtService;
import com.sitescope.crawler.crawl.sitemap.SitemapService;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Picks the oldest eligible job and runs it end to end: robots and sitemap discovery, the
 * render run, link-graph finalize, completion. One job at a time per process.
 */
@Service
public class CrawlJobProcessor {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobProcessor.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final CrawlerProperties properties;
    private final CrawlJobRepository jobRepository;
    private final CrawlJdbcRepository repository;
    private final PersistenceRetry retry;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;
    private final RenderEngine renderEngine;
    private final PageCrawlHandler pageHandler;
    private final LinkGraphService linkGraphService;
    private final CompletionNotificationService notificationService;
    private final PoliteHttpClient httpClient;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile String currentJobId;

    public CrawlJobProcessor(
        CrawlerProperties properties,
        CrawlJobRepository jobRepository,
        CrawlJdbcRepository repository,
        PersistenceRetry retry,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService,
        RenderEngine renderEngine,
        PageCrawlHandler pageHandler,
        LinkGraphService linkGraphService,
        CompletionNotificationService notificationService,
        PoliteHttpClient httpClient
    ) {
        this.properties = properties;
        this.jobRepository = jobRepository;
        this.repository = repository;
        this.retry = retry;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
        this.renderEngine = renderEngine;
        this.pageHandler = pageHandler;
        this.linkGraphService = linkGraphService;
        this.notificationService = notificationService;
        this.httpClient = httpClient;
    }

    /**
     * Processes at most one eligible job. A call made while another is in flight returns
     * immediately.
     *
     * @return true when a job was picked up
     */
    public boolean pollAndProcess() {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Poll skipped, jobId={} still in flight", currentJobId);
            return false;
        }
        try {
            CrawlJob job = retry.execute("findNextEligibleJob", jobRepository::findNextEligibleJob);
            if (job == null) {
                return false;
            }
            currentJobId = job.id();
            process(job);
            return true;
        } finally {
            currentJobId = null;
            inFlight.set(false);
        }
    }

    public boolean isInFlight() {
        return inFlight.get();
    }

    public String currentJobId() {
        return currentJobId;
    }

    void process(CrawlJob job) {
        log.info("Processing crawl jobId={} url={} status={} maxPages={}", job.id(), job.url(), job.status().dbValue(), job.maxPages());
        try {
            retry.run("markRunning", () -> jobRepository.markRunning(job.id()));
            Set<String> stored = retry.execute("findPageAddresses", () -> repository.findPageAddresses(job.id()));
            CrawlSession session = new CrawlSession(job, stored);
            if (session.isResumed()) {
                log.info("Resuming crawl jobId={} storedPages={}", job.id(), stored.size());
            }

            RobotsResult robots = discoverRobots(session);
            List<SitemapRecord> sitemaps = discoverSitemaps(session, robots);
            List<String> seeds = buildFrontier(session, sitemaps);

            RenderOptions options = new RenderOptions(
                job.maxPages(),
                Duration.ofSeconds(properties.getRender().getNavigationTimeoutSeconds()),
                properties.getRender().getMaxPageBytes(),
                job.takeScreenshots()
            );
            log.info("Starting render run jobId={} seeds={} maxRequests={}", job.id(), seeds.size(), options.maxRequests());
            renderEngine.run(
                seeds,
                options,
                (page, frontier) -> pageHandler.handle(session, page, frontier),
                (url, reason) -> log.warn("Page fetch failed jobId={} url={} reason={}", job.id(), url, reason)
            );
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Render run interrupted jobId={}, leaving job running for the next poll", job.id());
                return;
            }

            linkGraphService.finalizeJob(job.id());
            int pageCount = retry.execute("countPages", () -> repository.countPages(job.id()));
            retry.run("markCompleted", () -> jobRepository.markCompleted(job.id(), pageCount));
            log.info("Completed crawl jobId={} pages={}", job.id(), pageCount);
        } catch (RuntimeException e) {
            log.error("Crawl failed jobId={}", job.id(), e);
            markFailed(job.id(), e);
            return;
        }
        notificationService.dispatch(job.id());
    }

    private RobotsResult discoverRobots(CrawlSession session) {
        String jobId = session.jobId();
        RobotsResult robots = robotsTxtService.fetch(session.targetUrl());
        session.setRobots(robots);
        bestEffort("saveRobots", jobId, () -> jobRepository.saveRobots(jobId, robots));

        // a null delay clears whatever an earlier job on this host left behind
        Duration crawlDelay = robotsTxtService.crawlDelay(robots);
        httpClient.setHostDelay(UrlIdentity.hostOf(session.targetUrl()), crawlDelay);
        if (crawlDelay != null) {
            log.info("Applying crawl-delay jobId={} delayMs={}", jobId, crawlDelay.toMillis());
        }
        return robots;
    }

    private List<SitemapRecord> discoverSitemaps(CrawlSession session, RobotsResult robots) {
        String jobId = session.jobId();
        List<SitemapRecord> sitemaps;
        try {
            sitemaps = sitemapService.discover(session.targetUrl(), robots.sitemapUrls());
        } catch (RuntimeException e) {
            log.warn("Sitemap discovery failed jobId={}", jobId, e);
            return List.of();
        }
        int urlCount = sitemaps.stream().mapToInt(SitemapRecord::urlCount).sum();
        bestEffort("saveSitemaps", jobId, () -> {
            repository.saveSitemaps(jobId, sitemaps);
            jobRepository.saveSitemapSummary(jobId, sitemaps.size(), urlCount);
        });
        return sitemaps;
    }

    /**
     * The target URL first, then the sitemap URLs robots does not disallow.
     */
    List<String> buildFrontier(CrawlSession session, List<SitemapRecord> sitemaps) {
        Set<String> seeds = new LinkedHashSet<>();
        seeds.add(session.targetUrl());
        if (!session.job().crawlSitemap() || sitemaps.isEmpty()) {
            return List.copyOf(seeds);
        }
        boolean respectRobots = properties.getRobots().isRespectDirectives();
        int skipped = 0;
        for (String url : sitemapService.extractUrlsForCrawling(sitemaps, session.targetUrl())) {
            if (respectRobots && !robotsTxtService.isAllowed(session.robots(), url)) {
                skipped++;
                continue;
            }
            seeds.add(url);
        }
        log.info("Initial frontier jobId={} seeds={} skipped={}", session.jobId(), seeds.size(), skipped);
        return List.copyOf(seeds);
    }

    private void bestEffort(String operation, String jobId, Runnable action) {
        try {
            retry.run(operation, action);
        } catch (RuntimeException e) {
            log.warn("Discovery data not stored jobId={} operation={}", jobId, operation, e);
        }
    }

    private void markFailed(String jobId, RuntimeException error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        if (message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        try {
            jobRepository.markFailed(jobId, message);
        } catch (RuntimeException e) {
            log.error("Failed to record crawl failure jobId={}", jobId, e);
        }
    }
}
