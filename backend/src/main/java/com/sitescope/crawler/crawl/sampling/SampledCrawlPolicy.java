package com.sitescope.crawler.crawl.sampling;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Breadth limiter for sampled crawls. Pages at level 0 or 1 always pass; deeper pages pass
 * while their post type has been processed fewer than {@code crawler.sampling.per-category-quota}
 * times. Enqueue-time checks are optimistic, the process-time check is authoritative.
 */
@Component
public class SampledCrawlPolicy {
    private static final Logger log = LoggerFactory.getLogger(SampledCrawlPolicy.class);

    private final CrawlerProperties properties;

    public SampledCrawlPolicy(CrawlerProperties properties) {
        this.properties = properties;
    }

    /**
     * Number of non-empty path segments; the root is level 0. Unparseable URLs count as level 1.
     */
    public static int urlLevel(String url) {
        int depth = UrlIdentity.pathDepth(url);
        return depth < 0 ? 1 : depth;
    }

    public boolean admit(String url, SamplingCounters counters) {
        int level = urlLevel(url);
        if (level <= 1) {
            return true;
        }
        PostType type = PostTypeClassifier.classify(url);
        int count = counters.get(type);
        if (count >= properties.getSampling().getPerCategoryQuota()) {
            log.debug("Sampling quota reached type={} count={} level={} url={}", type.label(), count, level, url);
            return false;
        }
        return true;
    }

    /**
     * Counts a processed page against its post type. Only level-2+ pages are counted.
     */
    public PostType recordProcessed(String url, String pageTitle, SamplingCounters counters) {
        PostType type = PostTypeClassifier.classify(url, pageTitle);
        int level = urlLevel(url);
        if (level > 1) {
            int count = counters.increment(type);
            log.debug(
                "Sampled page type={} count={}/{} level={} url={}",
                type.label(),
                count,
                properties.getSampling().getPerCategoryQuota(),
                level,
                url
            );
        }
        return type;
    }
}
