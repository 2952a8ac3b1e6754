package com.sitescope.crawler.crawl.sitemap;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.model.HttpFetchResult;
import com.sitescope.crawler.crawl.model.SitemapKind;
import com.sitescope.crawler.crawl.model.SitemapProvenance;
import com.sitescope.crawler.crawl.model.SitemapRecord;
import com.sitescope.crawler.crawl.model.SitemapUrlEntry;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPInputStream;

@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);

    private final PoliteHttpClient httpClient;
    private final CrawlerProperties properties;

    public SitemapService(PoliteHttpClient httpClient, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /**
     * Fetches the sitemaps declared in robots.txt, or the well-known locations when robots
     * declared none, and follows index files recursively. Every URL is fetched at most once
     * per call and at most {@code crawler.sitemap.max-sitemaps} records are produced.
     *
     * @return the discovery arena in fetch order; a child always follows its parent
     */
    public List<SitemapRecord> discover(String baseUrl, List<String> robotsSitemapUrls) {
        DiscoveryRun run = new DiscoveryRun(properties.getSitemap().getMaxSitemaps());

        Set<String> seeds = new LinkedHashSet<>();
        SitemapProvenance provenance;
        if (robotsSitemapUrls != null && !robotsSitemapUrls.isEmpty()) {
            robotsSitemapUrls.stream().filter(url -> url != null && !url.isBlank()).map(String::trim).forEach(seeds::add);
            provenance = SitemapProvenance.ROBOTS_TXT;
        } else {
            String origin = UrlIdentity.originOf(baseUrl);
            if (origin == null) {
                log.warn("sitemap discovery skipped, invalid base url={}", baseUrl);
                return List.of();
            }
            for (String path : properties.getSitemap().getWellKnownPaths()) {
                seeds.add(origin + path);
            }
            provenance = SitemapProvenance.WELL_KNOWN_PATH;
        }

        log.info("Starting sitemap discovery baseUrl={} seeds={} provenance={}", baseUrl, seeds.size(), provenance.dbValue());
        for (String seed : seeds) {
            if (run.isFull()) {
                log.info("Reached sitemap limit max={}", run.maxSitemaps);
                break;
            }
            SitemapRecord record = fetchAndParse(seed, null, provenance, run);
            if (record != null && record.isIndex()) {
                processChildren(record, run);
            }
        }
        log.info("Sitemap discovery complete baseUrl={} sitemaps={}", baseUrl, run.arena.size());
        return List.copyOf(run.arena);
    }

    /**
     * Flattens urlset entries across the forest, keeping www/apex-equivalent hosts of
     * {@code baseUrl}, first occurrence wins, capped at {@code crawler.sitemap.max-frontier-urls}.
     */
    public List<String> extractUrlsForCrawling(List<SitemapRecord> sitemaps, String baseUrl) {
        String baseHost = UrlIdentity.hostOf(baseUrl);
        int max = properties.getSitemap().getMaxFrontierUrls();
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        if (baseHost == null || sitemaps == null) {
            return List.of();
        }
        for (SitemapRecord sitemap : sitemaps) {
            if (sitemap.urls() == null) {
                continue;
            }
            for (SitemapUrlEntry entry : sitemap.urls()) {
                String host = UrlIdentity.hostOf(entry.loc());
                if (host == null
                    || !UrlIdentity.isHttpUrl(entry.loc())
                    || entry.loc().length() > UrlIdentity.MAX_ADDRESS_LENGTH) {
                    log.debug("Skipping invalid sitemap url={}", entry.loc());
                    continue;
                }
                if (UrlIdentity.isWwwEquivalent(host, baseHost)) {
                    urls.add(entry.loc());
                }
            }
        }
        List<String> result = urls.stream().limit(max).toList();
        log.info("Extracted sitemap urls baseUrl={} unique={} kept={}", baseUrl, urls.size(), result.size());
        return result;
    }

    private void processChildren(SitemapRecord parent, DiscoveryRun run) {
        for (String childUrl : parent.childSitemapUrls()) {
            if (run.isFull()) {
                return;
            }
            SitemapRecord child = fetchAndParse(childUrl, parent.id(), SitemapProvenance.SITEMAP_INDEX, run);
            if (child != null && child.isIndex()) {
                processChildren(child, run);
            }
        }
    }

    SitemapRecord fetchAndParse(String sitemapUrl, Integer parentId, SitemapProvenance provenance, DiscoveryRun run) {
        if (!run.processed.add(sitemapUrl)) {
            log.debug("Skipping already processed sitemap url={}", sitemapUrl);
            return null;
        }
        if (sitemapUrl.length() > UrlIdentity.MAX_ADDRESS_LENGTH) {
            log.debug("Skipping oversized sitemap url length={}", sitemapUrl.length());
            return null;
        }
        int id = run.arena.size();

        HttpFetchResult fetch = httpClient.get(
            sitemapUrl,
            "application/xml,text/xml;q=0.9,*/*;q=0.1",
            properties.getSitemap().getMaxBytes(),
            Duration.ofSeconds(properties.getSitemap().getTimeoutSeconds())
        );
        long responseTimeMs = fetch.duration() == null ? 0 : fetch.duration().toMillis();
        Integer status = fetch.statusCode() > 0 ? fetch.statusCode() : null;

        if (!fetch.isSuccessful()) {
            log.warn("Sitemap not accessible url={} failure={}", sitemapUrl, fetch.describeFailure());
            return run.add(failed(id, parentId, sitemapUrl, provenance, status, responseTimeMs, fetch.describeFailure()));
        }

        String xmlPayload;
        try {
            xmlPayload = extractXmlPayload(sitemapUrl, fetch);
        } catch (IOException e) {
            log.warn("Sitemap gzip decode failed url={}", sitemapUrl, e);
            return run.add(failed(id, parentId, sitemapUrl, provenance, status, responseTimeMs, "gzip_decode_error"));
        }

        SitemapParser.ParsedSitemap parsed = SitemapParser.parse(xmlPayload);
        log.info(
            "Parsed sitemap url={} kind={} urls={} children={}",
            sitemapUrl,
            parsed.kind().dbValue(),
            parsed.urls().size(),
            parsed.childSitemapUrls().size()
        );
        return run.add(new SitemapRecord(
            id,
            parentId,
            sitemapUrl,
            provenance,
            parsed.kind(),
            xmlPayload,
            status,
            responseTimeMs,
            parsed.urls(),
            parsed.childSitemapUrls(),
            parsed.lastmod(),
            parsed.changefreq(),
            parsed.priority(),
            null
        ));
    }

    private SitemapRecord failed(
        int id,
        Integer parentId,
        String url,
        SitemapProvenance provenance,
        Integer status,
        long responseTimeMs,
        String error
    ) {
        return new SitemapRecord(
            id, parentId, url, provenance, SitemapKind.UNKNOWN, null, status, responseTimeMs,
            List.of(), List.of(), null, null, null, error
        );
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return fetch.body() != null ? fetch.body() : new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(byte[] bodyBytes) {
        // .gz urls and gzip content-encoding are both detected by the magic bytes; a body
        // already inflated by a proxy is plain xml whatever the url says
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    static final class DiscoveryRun {
        private final int maxSitemaps;
        private final Set<String> processed = new LinkedHashSet<>();
        private final List<SitemapRecord> arena = new ArrayList<>();

        DiscoveryRun(int maxSitemaps) {
            this.maxSitemaps = maxSitemaps;
        }

        boolean isFull() {
            return arena.size() >= maxSitemaps;
        }

        SitemapRecord add(SitemapRecord record) {
            arena.add(record);
            return record;
        }
    }
}
