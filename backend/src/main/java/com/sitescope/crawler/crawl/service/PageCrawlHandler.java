package com.sitescope.crawler.crawl.service;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.links.LinkGraphService;
import com.sitescope.crawler.crawl.model.CrawlJob;
import com.sitescope.crawler.crawl.model.LinkCandidate;
import com.sitescope.crawler.crawl.model.PageData;
import com.sitescope.crawler.crawl.model.PageRef;
import com.sitescope.crawler.crawl.page.LinkExtractor;
import com.sitescope.crawler.crawl.page.PageExtractor;
import com.sitescope.crawler.crawl.persistence.CrawlJdbcRepository;
import com.sitescope.crawler.crawl.persistence.CrawlJobRepository;
import com.sitescope.crawler.crawl.persistence.PersistenceRetry;
import com.sitescope.crawler.crawl.render.Frontier;
import com.sitescope.crawler.crawl.render.RenderedPage;
import com.sitescope.crawler.crawl.robots.RobotsTxtService;
import com.sitescope.crawler.crawl.sampling.PostType;
import com.sitescope.crawler.crawl.sampling.PostTypeClassifier;
import com.sitescope.crawler.crawl.sampling.SampledCrawlPolicy;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-page callback of a crawl run: admission, extraction, storage, edge recording and
 * frontier growth. Store failures propagate and end the run.
 */
@Component
public class PageCrawlHandler {
    private static final Logger log = LoggerFactory.getLogger(PageCrawlHandler.class);

    private final CrawlerProperties properties;
    private final PageExtractor pageExtractor;
    private final LinkExtractor linkExtractor;
    private final LinkGraphService linkGraphService;
    private final SampledCrawlPolicy samplingPolicy;
    private final RobotsTxtService robotsTxtService;
    private final ScreenshotStore screenshotStore;
    private final CrawlJdbcRepository repository;
    private final CrawlJobRepository jobRepository;
    private final PersistenceRetry retry;

    public PageCrawlHandler(
        CrawlerProperties properties,
        PageExtractor pageExtractor,
        LinkExtractor linkExtractor,
        LinkGraphService linkGraphService,
        SampledCrawlPolicy samplingPolicy,
        RobotsTxtService robotsTxtService,
        ScreenshotStore screenshotStore,
        CrawlJdbcRepository repository,
        CrawlJobRepository jobRepository,
        PersistenceRetry retry
    ) {
        this.properties = properties;
        this.pageExtractor = pageExtractor;
        this.linkExtractor = linkExtractor;
        this.linkGraphService = linkGraphService;
        this.samplingPolicy = samplingPolicy;
        this.robotsTxtService = robotsTxtService;
        this.screenshotStore = screenshotStore;
        this.repository = repository;
        this.jobRepository = jobRepository;
        this.retry = retry;
    }

    public void handle(CrawlSession session, RenderedPage page, Frontier frontier) {
        CrawlJob job = session.job();
        String address = UrlIdentity.normalize(page.urlForProcessing(), session.ignoreQuery());
        session.domainState().recordFirstFetch(page.requestedUrl(), page.urlForProcessing());

        if (address.length() > UrlIdentity.MAX_ADDRESS_LENGTH) {
            log.debug("Skipping oversized address jobId={} length={}", job.id(), address.length());
            return;
        }
        if (!UrlIdentity.isSameSite(address, session.targetUrl(), session.domainState())) {
            log.debug("Skipping off-site page jobId={} requested={} loaded={}", job.id(), page.requestedUrl(), address);
            return;
        }
        if (session.isSeen(address)) {
            if (session.claimResumedPage(address)) {
                log.debug("Following links of previously stored page jobId={} address={}", job.id(), address);
                enqueueLinks(session, linkTargets(session, linkExtractor.extract(page.document())), frontier);
            } else {
                log.debug("Skipping duplicate jobId={} address={}", job.id(), address);
            }
            return;
        }
        if (session.isPageBudgetExhausted()) {
            log.debug("Max pages reached jobId={} maxPages={}", job.id(), job.maxPages());
            return;
        }
        if (job.sampledCrawl() && !samplingPolicy.admit(address, session.samplingCounters())) {
            return;
        }
        session.markSeen(address);

        PageData pageData;
        List<LinkCandidate> links;
        try {
            pageData = pageExtractor.extract(page, address, session.targetUrl());
            links = linkExtractor.extract(page.document());
        } catch (RuntimeException e) {
            log.warn("Page extraction failed jobId={} address={}", job.id(), address, e);
            return;
        }
        if (job.takeScreenshots() && page.screenshot() != null) {
            pageData = pageData.withScreenshotUrl(screenshotStore.save(job.id(), address, page.screenshot()));
        }

        PostType postType = PostTypeClassifier.classify(address, pageData.title());
        PageData toStore = pageData;
        PageRef stored = retry.execute("insertPage", () -> repository.insertPage(job.id(), toStore, postType.label()));
        if (stored == null) {
            log.debug("Skipping duplicate jobId={} address={}", job.id(), address);
            return;
        }
        int count = session.incrementPageCount();
        if (job.sampledCrawl()) {
            samplingPolicy.recordProcessed(address, pageData.title(), session.samplingCounters());
        }

        List<String> internalTargets = linkGraphService.recordEdges(
            job.id(),
            session.targetUrl(),
            stored,
            links,
            session.domainState(),
            session.ignoreQuery()
        );
        enqueueLinks(session, internalTargets, frontier);

        retry.run("updateProgress", () -> jobRepository.updateProgress(job.id(), count, address));
        log.info("Crawled jobId={} page={}/{} address={}", job.id(), count, job.maxPages(), address);
    }

    private List<String> linkTargets(CrawlSession session, List<LinkCandidate> links) {
        return links.stream()
            .map(LinkCandidate::href)
            .filter(UrlIdentity::isHttpUrl)
            .map(href -> UrlIdentity.normalize(href, session.ignoreQuery()))
            .toList();
    }

    /**
     * Queues internal targets not yet seen, allowed by robots and, for sampled crawls,
     * still under their post-type quota. Pages stored by an earlier run stay queueable until
     * they have been revisited once.
     */
    private void enqueueLinks(CrawlSession session, List<String> targets, Frontier frontier) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String target : targets) {
            if (target.length() > UrlIdentity.MAX_ADDRESS_LENGTH) {
                continue;
            }
            if (session.isSeen(target) && !session.isAwaitingRevisit(target)) {
                continue;
            }
            if (!UrlIdentity.isInternal(target, session.targetUrl(), session.domainState())) {
                continue;
            }
            if (properties.getRobots().isRespectDirectives() && !robotsTxtService.isAllowed(session.robots(), target)) {
                log.debug("Robots disallows jobId={} url={}", session.jobId(), target);
                continue;
            }
            if (session.job().sampledCrawl() && !samplingPolicy.admit(target, session.samplingCounters())) {
                continue;
            }
            candidates.add(target);
        }
        if (!candidates.isEmpty()) {
            int added = frontier.enqueue(List.copyOf(candidates));
            log.debug("Enqueued jobId={} candidates={} new={}", session.jobId(), candidates.size(), added);
        }
    }
}
