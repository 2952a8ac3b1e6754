package com.sitescope.crawler.crawl.service;

import com.sitescope.crawler.crawl.model.CrawlJob;
import com.sitescope.crawler.crawl.model.RobotsResult;
import com.sitescope.crawler.crawl.sampling.SamplingCounters;
import com.sitescope.crawler.crawl.util.DomainState;
import com.sitescope.crawler.crawl.util.UrlIdentity;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state of one job's crawl run: seen addresses, sampling counters and domain
 * equivalence. Created fresh per run and confined to the thread processing the job.
 */
public class CrawlSession {
    private final CrawlJob job;
    private final String targetUrl;
    private final DomainState domainState;
    private final SamplingCounters samplingCounters = new SamplingCounters();
    private final Set<String> seen = new HashSet<>();
    private final Set<String> storedBeforeResume = new HashSet<>();
    private final boolean resumed;
    private RobotsResult robots;
    private int pageCount;

    public CrawlSession(CrawlJob job, Set<String> storedAddresses) {
        this.job = job;
        this.targetUrl = UrlIdentity.normalize(job.url(), job.ignoreUrlParameters());
        this.domainState = new DomainState(UrlIdentity.hostOf(targetUrl));
        if (storedAddresses != null) {
            seen.addAll(storedAddresses);
            storedBeforeResume.addAll(storedAddresses);
            pageCount = storedAddresses.size();
        }
        this.resumed = pageCount > 0;
    }

    public CrawlJob job() {
        return job;
    }

    public String jobId() {
        return job.id();
    }

    public String targetUrl() {
        return targetUrl;
    }

    public boolean ignoreQuery() {
        return job.ignoreUrlParameters();
    }

    public DomainState domainState() {
        return domainState;
    }

    public SamplingCounters samplingCounters() {
        return samplingCounters;
    }

    public boolean isSeen(String address) {
        return seen.contains(address);
    }

    public void markSeen(String address) {
        seen.add(address);
    }

    /**
     * True once per address stored by an earlier run of a resumed job, so its links can be
     * followed again without storing the page twice.
     */
    public boolean claimResumedPage(String address) {
        return storedBeforeResume.remove(address);
    }

    public boolean isAwaitingRevisit(String address) {
        return storedBeforeResume.contains(address);
    }

    public boolean isResumed() {
        return resumed;
    }

    public int pageCount() {
        return pageCount;
    }

    public int incrementPageCount() {
        return ++pageCount;
    }

    public boolean isPageBudgetExhausted() {
        return pageCount >= job.maxPages();
    }

    public RobotsResult robots() {
        return robots;
    }

    public void setRobots(RobotsResult robots) {
        this.robots = robots;
    }
}
