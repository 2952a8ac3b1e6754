package com.sitescope.crawler.crawl.robots;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.model.HttpFetchResult;
import com.sitescope.crawler.crawl.model.RobotsResult;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final int MAX_ROBOTS_BYTES = 512_000;

    private final CrawlerProperties properties;
    private final PoliteHttpClient httpClient;

    public RobotsTxtService(CrawlerProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    /**
     * Fetches {@code /robots.txt} for the origin of {@code baseUrl}. Never throws: a missing or
     * unreachable file yields a result with null content and empty directives.
     */
    public RobotsResult fetch(String baseUrl) {
        String origin = UrlIdentity.originOf(baseUrl);
        if (origin == null) {
            log.warn("robots fetch skipped, invalid base url={}", baseUrl);
            return RobotsResult.unavailable(null, null, 0, "invalid base url: " + baseUrl);
        }
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(
            robotsUrl,
            "text/plain,text/*;q=0.9,*/*;q=0.1",
            MAX_ROBOTS_BYTES,
            Duration.ofSeconds(properties.getRobots().getTimeoutSeconds())
        );
        long responseTimeMs = fetch.duration() == null ? 0 : fetch.duration().toMillis();

        if (!fetch.isSuccessful()) {
            Integer status = fetch.statusCode() > 0 ? fetch.statusCode() : null;
            log.warn(
                "robots fetch failed url={} status={} errorCode={} errorMessage={}",
                robotsUrl,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage()
            );
            return RobotsResult.unavailable(robotsUrl, status, responseTimeMs, fetch.describeFailure());
        }

        String content = fetch.body() == null ? "" : fetch.body();
        RobotsDirectives directives = RobotsDirectives.parse(content);
        log.info(
            "Loaded robots url={} agents={} sitemaps={}",
            robotsUrl,
            directives.getUserAgents().size(),
            directives.getSitemapUrls().size()
        );
        return new RobotsResult(robotsUrl, content, fetch.statusCode(), responseTimeMs, directives, null);
    }

    public boolean isAllowed(RobotsResult robots, String url) {
        if (robots == null || robots.directives() == null) {
            return true;
        }
        return robots.directives().isAllowed(UrlIdentity.pathAndQuery(url), properties.getRobots().getAgentToken());
    }

    /**
     * Crawl-delay for the configured agent, capped, or null when none applies.
     */
    public Duration crawlDelay(RobotsResult robots) {
        if (robots == null || robots.directives() == null) {
            return null;
        }
        Double seconds = robots.directives().crawlDelayFor(properties.getRobots().getAgentToken());
        if (seconds == null || seconds <= 0) {
            return null;
        }
        double capped = Math.min(seconds, properties.getRobots().getMaxCrawlDelaySeconds());
        return capped <= 0 ? null : Duration.ofMillis((long) (capped * 1000));
    }
}
