package com.sitescope.crawler.crawl.service;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.CrawlFixtures;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.model.CrawlJob;
import com.sitescope.crawler.crawl.model.CrawlJobRequest;
import com.sitescope.crawler.crawl.model.CrawlJobStatus;
import com.sitescope.crawler.crawl.model.LinkEdge;
import com.sitescope.crawler.crawl.model.LinkType;
import com.sitescope.crawler.crawl.model.PageLinkMetrics;
import com.sitescope.crawler.crawl.model.RobotsResult;
import com.sitescope.crawler.crawl.model.SitemapKind;
import com.sitescope.crawler.crawl.model.SitemapProvenance;
import com.sitescope.crawler.crawl.model.SitemapRecord;
import com.sitescope.crawler.crawl.persistence.CrawlJdbcRepository;
import com.sitescope.crawler.crawl.persistence.CrawlJobRepository;
import com.sitescope.crawler.crawl.render.Frontier;
import com.sitescope.crawler.crawl.render.RenderEngine;
import com.sitescope.crawler.crawl.render.RenderOptions;
import com.sitescope.crawler.crawl.render.RenderedPage;
import com.sitescope.crawler.crawl.robots.RobotsTxtService;
import com.sitescope.crawler.crawl.sitemap.SitemapService;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlJobProcessorTest {
    private static final String HOME = "https://example.com/";

    @MockBean
    private RobotsTxtService robotsTxtService;

    @MockBean
    private SitemapService sitemapService;

    @MockBean
    private RenderEngine renderEngine;

    @Autowired
    private CrawlJobProcessor processor;

    @Autowired
    private CrawlJobRepository jobRepository;

    @Autowired
    private CrawlJdbcRepository repository;

    @Autowired
    private CrawlerProperties properties;

    @Autowired
    private PoliteHttpClient httpClient;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private final List<String> requested = new ArrayList<>();
    private byte[] screenshot;

    @BeforeEach
    void setUp() {
        when(robotsTxtService.fetch(anyString()))
            .thenReturn(RobotsResult.unavailable("https://example.com/robots.txt", 404, 3, "HTTP 404"));
        when(robotsTxtService.isAllowed(any(), anyString())).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        properties.getRobots().setRespectDirectives(false);
        httpClient.setHostDelay("example.com", null);
    }

    @Test
    void queryVariantsCollapseWhenParametersAreIgnored() {
        String jobId = jobRepository.insertJob(
            new CrawlJobRequest("https://example.com/?ref=1", 10, false, true, false, true, false, null)
        );
        SitemapRecord sitemap = new SitemapRecord(
            0, null, "https://example.com/sitemap.xml", SitemapProvenance.WELL_KNOWN_PATH, SitemapKind.URLSET,
            "<urlset/>", 200, 4, List.of(), List.of(), null, null, null, null
        );
        when(sitemapService.discover(eq(HOME), anyList())).thenReturn(List.of(sitemap));
        when(sitemapService.extractUrlsForCrawling(anyList(), eq(HOME)))
            .thenReturn(List.of("https://example.com/?ref=1", "https://example.com/about"));
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, "<a href=\"/about?utm_source=x\">About</a><a href=\"https://partner.test/\">Partner</a>");
        site.put("https://example.com/?ref=1", site.get(HOME));
        site.put("https://example.com/about", "<title>About</title><a href=\"/\">Home</a>");
        serve(site);

        assertThat(processor.pollAndProcess()).isTrue();

        assertThat(requested).containsExactly(HOME, "https://example.com/?ref=1", "https://example.com/about");
        assertThat(repository.findPageAddresses(jobId)).containsExactly(HOME, "https://example.com/about");
        CrawlJob job = jobRepository.findJob(jobId);
        assertThat(job.status()).isEqualTo(CrawlJobStatus.COMPLETED);
        assertThat(job.pagesCrawled()).isEqualTo(2);
        assertThat(job.pagesRemaining()).isZero();

        List<PageLinkMetrics> metrics = repository.findPageLinkMetrics(jobId);
        PageLinkMetrics home = metrics.get(0);
        PageLinkMetrics about = metrics.get(1);
        assertThat(home.outlinks()).isEqualTo(2);
        assertThat(home.externalOutlinks()).isEqualTo(1);
        assertThat(home.inlinks()).isEqualTo(1);
        assertThat(about.inlinks()).isEqualTo(1);
        assertThat(about.percentOfTotal()).isEqualTo(50.0);
    }

    @Test
    void storesNoMoreThanMaxPages() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 2));
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, "<a href=\"/a\">a</a><a href=\"/b\">b</a><a href=\"/c\">c</a>");
        site.put("https://example.com/a", "<a href=\"/d\">d</a>");
        site.put("https://example.com/b", "b");
        site.put("https://example.com/c", "c");
        serve(site);

        processor.pollAndProcess();

        assertThat(repository.countPages(jobId)).isEqualTo(2);
        CrawlJob job = jobRepository.findJob(jobId);
        assertThat(job.status()).isEqualTo(CrawlJobStatus.COMPLETED);
        assertThat(job.pagesCrawled()).isEqualTo(2);
    }

    @Test
    void sampledCrawlCapsDeepPagesPerPostType() {
        String jobId = jobRepository.insertJob(
            new CrawlJobRequest(HOME, 50, false, false, true, false, false, null)
        );
        StringBuilder home = new StringBuilder("<a href=\"/blog\">Blog</a>");
        for (int i = 1; i <= 5; i++) {
            home.append("<a href=\"/blog/post-").append(i).append("\">post</a>");
        }
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, home.toString());
        site.put("https://example.com/blog", "<title>Blog</title>");
        for (int i = 1; i <= 5; i++) {
            site.put("https://example.com/blog/post-" + i, "<title>Post " + i + "</title>");
        }
        serve(site);

        processor.pollAndProcess();

        Set<String> stored = repository.findPageAddresses(jobId);
        assertThat(stored).contains(HOME, "https://example.com/blog");
        assertThat(stored.stream().filter(address -> address.contains("/blog/post-"))).hasSize(3);
    }

    @Test
    void resumedJobRevisitsStoredPagesWithoutStoringThemAgain() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        jobRepository.markRunning(jobId);
        repository.insertPage(jobId, CrawlFixtures.page(HOME), "homepage");
        repository.insertPage(jobId, CrawlFixtures.page("https://example.com/about"), "section");
        jobRepository.updateProgress(jobId, 2, "https://example.com/about");
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, "<a href=\"/about\">About</a>");
        site.put("https://example.com/about", "<a href=\"/contact\">Contact</a>");
        site.put("https://example.com/contact", "<title>Contact</title>");
        serve(site);

        processor.pollAndProcess();

        assertThat(repository.findPageAddresses(jobId))
            .containsExactly(HOME, "https://example.com/about", "https://example.com/contact");
        assertThat(jobRepository.findJob(jobId).pagesCrawled()).isEqualTo(3);
    }

    @Test
    void renderFailureMarksJobFailed() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        doThrow(new IllegalStateException("browser crashed"))
            .when(renderEngine).run(anyList(), any(), any(), any());

        assertThat(processor.pollAndProcess()).isTrue();

        CrawlJob job = jobRepository.findJob(jobId);
        assertThat(job.status()).isEqualTo(CrawlJobStatus.FAILED);
        assertThat(job.errorMessage()).isEqualTo("browser crashed");
        assertThat(processor.isInFlight()).isFalse();
        assertThat(jobRepository.findNextEligibleJob()).isNull();
    }

    @Test
    void pollWhileJobInFlightIsSkipped() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        AtomicReference<Boolean> nestedPoll = new AtomicReference<>();
        AtomicReference<String> currentJob = new AtomicReference<>();
        doAnswer(invocation -> {
            currentJob.set(processor.currentJobId());
            nestedPoll.set(processor.pollAndProcess());
            return null;
        }).when(renderEngine).run(anyList(), any(), any(), any());

        assertThat(processor.pollAndProcess()).isTrue();

        assertThat(nestedPoll.get()).isFalse();
        assertThat(currentJob.get()).isEqualTo(jobId);
        assertThat(processor.currentJobId()).isNull();
    }

    @Test
    void robotsDisallowedUrlsLeaveTheFrontierWhenDirectivesAreRespected() {
        properties.getRobots().setRespectDirectives(true);
        doReturn(false).when(robotsTxtService).isAllowed(any(), argThat(url -> url != null && url.contains("/private")));
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        givenSitemapUrls("https://example.com/private/report", "https://example.com/pricing");
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, "<a href=\"/private/admin\">Admin</a><a href=\"/about\">About</a>");
        site.put("https://example.com/pricing", "<title>Pricing</title>");
        site.put("https://example.com/about", "<title>About</title>");
        site.put("https://example.com/private/report", "<title>Report</title>");
        site.put("https://example.com/private/admin", "<title>Admin</title>");
        serve(site);

        processor.pollAndProcess();

        assertThat(requested).noneMatch(url -> url.contains("/private"));
        assertThat(repository.findPageAddresses(jobId))
            .containsExactly(HOME, "https://example.com/pricing", "https://example.com/about");
    }

    @Test
    void robotsDirectivesDoNotFilterTheFrontierByDefault() {
        when(robotsTxtService.isAllowed(any(), anyString())).thenReturn(false);
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, "<a href=\"/about\">About</a><a href=\"/blog\">Blog</a>");
        site.put("https://example.com/about", "<title>About</title>");
        site.put("https://example.com/blog", "<title>Blog</title>");
        serve(site);

        processor.pollAndProcess();

        assertThat(repository.findPageAddresses(jobId))
            .containsExactly(HOME, "https://example.com/about", "https://example.com/blog");
    }

    @Test
    void redirectedFirstPageKeepsItsNewHostInternal() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        Map<String, String> site = new LinkedHashMap<>();
        site.put("https://shop-example.net/", "<a href=\"/about\">About</a><a href=\"https://example.com/contact\">Contact</a>");
        site.put("https://shop-example.net/about", "<title>About</title>");
        site.put("https://example.com/contact", "<title>Contact</title>");
        serve(site, Map.of(HOME, "https://shop-example.net/"));

        processor.pollAndProcess();

        assertThat(repository.findPageAddresses(jobId)).containsExactly(
            "https://shop-example.net/",
            "https://shop-example.net/about",
            "https://example.com/contact"
        );
        assertThat(repository.findEdges(jobId)).extracting(LinkEdge::type).containsOnly(LinkType.INTERNAL);
    }

    @Test
    void oversizedMarkupValuesDoNotFailTheJob() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        String longExternal = "https://partner.test/" + "p".repeat(5000);
        String home = "<html lang=\"" + "en-".repeat(30) + "\"><body>"
            + "<a href=\"/about\" target=\"" + "x".repeat(80) + "\" rel=\"" + "noopener ".repeat(40) + "\">About</a>"
            + "<a href=\"" + longExternal + "\">Partner</a>"
            + "<a href=\"mailto:team@example.com\">Mail</a>"
            + "<a href=\"tel:+15551234567\">Call</a>"
            + "</body></html>";
        Map<String, String> site = new LinkedHashMap<>();
        site.put(HOME, home);
        site.put("https://example.com/about", "<title>About</title>");
        serve(site);

        processor.pollAndProcess();

        CrawlJob job = jobRepository.findJob(jobId);
        assertThat(job.status()).isEqualTo(CrawlJobStatus.COMPLETED);
        assertThat(repository.findPageAddresses(jobId)).containsExactly(HOME, "https://example.com/about");
        List<LinkEdge> edges = repository.findEdges(jobId);
        assertThat(edges).extracting(LinkEdge::toAddress)
            .contains("https://example.com/about", "mailto:team@example.com", "tel:+15551234567")
            .doesNotContain(longExternal);
        assertThat(edges).filteredOn(edge -> edge.type() == LinkType.EXTERNAL).hasSize(2);
    }

    @Test
    void interruptedRenderRunLeavesJobResumable() {
        String jobId = jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        doAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return null;
        }).when(renderEngine).run(anyList(), any(), any(), any());

        boolean picked = processor.pollAndProcess();
        boolean wasInterrupted = Thread.interrupted();

        assertThat(picked).isTrue();
        assertThat(wasInterrupted).isTrue();
        CrawlJob job = jobRepository.findJob(jobId);
        assertThat(job.status()).isEqualTo(CrawlJobStatus.RUNNING);
        assertThat(job.completedAt()).isNull();
        assertThat(jobRepository.findNextEligibleJob().id()).isEqualTo(jobId);
    }

    @Test
    void crawlDelayFromAnEarlierJobIsCleared() {
        httpClient.setHostDelay("example.com", Duration.ofSeconds(5));
        jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        serve(Map.of(HOME, "<title>Home</title>"));

        processor.pollAndProcess();

        assertThat(httpClient.hostDelay("example.com")).isNull();
    }

    @Test
    void crawlDelayIsAppliedToTheJobHost() {
        when(robotsTxtService.crawlDelay(any())).thenReturn(Duration.ofSeconds(2));
        jobRepository.insertJob(CrawlJobRequest.of(HOME, 10));
        serve(Map.of(HOME, "<title>Home</title>"));

        processor.pollAndProcess();

        assertThat(httpClient.hostDelay("example.com")).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void screenshotsAreStoredForPagesThatHaveThem() {
        String jobId = jobRepository.insertJob(
            new CrawlJobRequest(HOME, 10, true, true, false, false, false, null)
        );
        screenshot = new byte[] {1, 2, 3};
        serve(Map.of(HOME, "<title>Home</title>"));

        processor.pollAndProcess();

        String screenshotUrl = jdbc.queryForObject(
            "SELECT screenshot_url FROM crawl_pages WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            String.class
        );
        assertThat(screenshotUrl).startsWith("/screenshots/" + jobId + "/example.com__").endsWith(".png");
    }

    @Test
    void nothingToProcess() {
        assertThat(processor.pollAndProcess()).isFalse();
    }

    private void givenSitemapUrls(String... urls) {
        SitemapRecord sitemap = new SitemapRecord(
            0, null, "https://example.com/sitemap.xml", SitemapProvenance.WELL_KNOWN_PATH, SitemapKind.URLSET,
            "<urlset/>", 200, 4, List.of(), List.of(), null, null, null, null
        );
        when(sitemapService.discover(eq(HOME), anyList())).thenReturn(List.of(sitemap));
        when(sitemapService.extractUrlsForCrawling(anyList(), eq(HOME))).thenReturn(List.of(urls));
    }

    private void serve(Map<String, String> site) {
        serve(site, Map.of());
    }

    /**
     * Replays {@code site} in FIFO order. {@code redirects} maps a requested URL to the URL it
     * ends up loading.
     */
    private void serve(Map<String, String> site, Map<String, String> redirects) {
        doAnswer(invocation -> {
            List<String> seeds = invocation.getArgument(0);
            RenderOptions options = invocation.getArgument(1);
            RenderEngine.PageHandler handler = invocation.getArgument(2);
            RenderEngine.FailureHandler failureHandler = invocation.getArgument(3);
            Deque<String> queue = new ArrayDeque<>(seeds);
            Set<String> queued = new HashSet<>(seeds);
            Frontier frontier = urls -> {
                int added = 0;
                for (String url : urls) {
                    if (queued.add(url)) {
                        queue.add(url);
                        added++;
                    }
                }
                return added;
            };
            int handled = 0;
            while (!queue.isEmpty() && handled < options.maxRequests()) {
                String url = queue.poll();
                handled++;
                requested.add(url);
                String loaded = redirects.getOrDefault(url, url);
                String html = site.get(loaded);
                if (html == null) {
                    failureHandler.onFailure(url, "http_404");
                    continue;
                }
                handler.handle(new RenderedPage(
                    url,
                    loaded,
                    200,
                    Map.of("Content-Type", List.of("text/html")),
                    html,
                    Jsoup.parse(html, loaded),
                    Duration.ofMillis(5),
                    screenshot
                ), frontier);
            }
            return null;
        }).when(renderEngine).run(anyList(), any(), any(), any());
    }
}
