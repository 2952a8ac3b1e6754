package com.sitescope.crawler.crawl.sitemap;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.model.HttpFetchResult;
import com.sitescope.crawler.crawl.model.SitemapKind;
import com.sitescope.crawler.crawl.model.SitemapProvenance;
import com.sitescope.crawler.crawl.model.SitemapRecord;
import com.sitescope.crawler.crawl.model.SitemapUrlEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SitemapServiceTest {

  @Mock
  private PoliteHttpClient httpClient;

  private final Map<String, HttpFetchResult> responses = new HashMap<>();
  private CrawlerProperties properties;
  private SitemapService service;

  @BeforeEach
  void setUp() {
    properties = new CrawlerProperties();
    service = new SitemapService(httpClient, properties);
    lenient().when(httpClient.get(anyString(), anyString(), anyInt(), any()))
        .thenAnswer(invocation -> {
          String url = invocation.getArgument(0);
          return responses.getOrDefault(url, status(url, 404, ""));
        });
  }

  @Test
  void followsIndexIntoChildren() {
    responses.put("https://example.com/sitemap_index.xml", xml("https://example.com/sitemap_index.xml", index(
        "https://example.com/posts.xml",
        "https://example.com/pages.xml")));
    responses.put("https://example.com/posts.xml", xml("https://example.com/posts.xml", urlset(
        "https://example.com/blog/a",
        "https://example.com/blog/b")));
    responses.put("https://example.com/pages.xml", xml("https://example.com/pages.xml", urlset(
        "https://example.com/about")));

    List<SitemapRecord> records = service.discover(
        "https://example.com/",
        List.of("https://example.com/sitemap_index.xml")
    );

    assertThat(records).hasSize(3);
    SitemapRecord root = records.get(0);
    assertEquals(SitemapKind.INDEX, root.kind());
    assertEquals(SitemapProvenance.ROBOTS_TXT, root.provenance());
    assertNull(root.parentId());
    for (SitemapRecord child : records.subList(1, 3)) {
      assertEquals(root.id(), child.parentId());
      assertEquals(SitemapProvenance.SITEMAP_INDEX, child.provenance());
      assertEquals(SitemapKind.URLSET, child.kind());
    }
    assertThat(service.extractUrlsForCrawling(records, "https://example.com/"))
        .containsExactly("https://example.com/blog/a", "https://example.com/blog/b", "https://example.com/about");
  }

  @Test
  void cyclicIndexesAreFetchedOnce() {
    responses.put("https://example.com/a.xml", xml("https://example.com/a.xml", index("https://example.com/b.xml")));
    responses.put("https://example.com/b.xml", xml("https://example.com/b.xml", index("https://example.com/a.xml")));

    List<SitemapRecord> records = service.discover("https://example.com/", List.of("https://example.com/a.xml"));

    assertThat(records).extracting(SitemapRecord::url)
        .containsExactly("https://example.com/a.xml", "https://example.com/b.xml");
    verify(httpClient, times(1)).get(eq("https://example.com/a.xml"), anyString(), anyInt(), any());
    verify(httpClient, times(1)).get(eq("https://example.com/b.xml"), anyString(), anyInt(), any());
  }

  @Test
  void stopsAtMaxSitemaps() {
    properties.getSitemap().setMaxSitemaps(2);
    responses.put("https://example.com/index.xml", xml("https://example.com/index.xml", index(
        "https://example.com/1.xml",
        "https://example.com/2.xml",
        "https://example.com/3.xml")));
    responses.put("https://example.com/1.xml", xml("https://example.com/1.xml", urlset("https://example.com/x")));

    List<SitemapRecord> records = service.discover("https://example.com/", List.of("https://example.com/index.xml"));

    assertThat(records).hasSize(2);
    verify(httpClient, never()).get(eq("https://example.com/2.xml"), anyString(), anyInt(), any());
  }

  @Test
  void fallsBackToWellKnownPathsAndRecordsFailures() {
    responses.put("https://example.com/sitemap.xml", xml("https://example.com/sitemap.xml", urlset("https://example.com/")));

    List<SitemapRecord> records = service.discover("https://example.com/some/page", List.of());

    assertThat(records).hasSize(properties.getSitemap().getWellKnownPaths().size());
    assertThat(records).allMatch(record -> record.provenance() == SitemapProvenance.WELL_KNOWN_PATH);
    SitemapRecord found = records.get(0);
    assertEquals("https://example.com/sitemap.xml", found.url());
    assertEquals(1, found.urlCount());
    SitemapRecord missing = records.get(1);
    assertEquals(SitemapKind.UNKNOWN, missing.kind());
    assertEquals(404, missing.statusCode());
    assertEquals("HTTP 404", missing.errorMessage());
  }

  @Test
  void decodesGzipPayload() throws Exception {
    String url = "https://example.com/sitemap.xml.gz";
    byte[] gzipped = gzip(urlset("https://example.com/gz-page"));
    responses.put(url, new HttpFetchResult(
        url,
        URI.create(url),
        200,
        new String(gzipped, StandardCharsets.ISO_8859_1),
        gzipped,
        "application/x-gzip",
        null,
        Map.of(),
        Instant.now(),
        Duration.ofMillis(12),
        null,
        null
    ));

    List<SitemapRecord> records = service.discover("https://example.com/", List.of(url));

    assertEquals(1, records.size());
    assertEquals(SitemapKind.URLSET, records.get(0).kind());
    assertEquals("https://example.com/gz-page", records.get(0).urls().get(0).loc());
    assertThat(records.get(0).content()).contains("<urlset");
  }

  @Test
  void brokenGzipIsRecordedAsDecodeError() {
    String url = "https://example.com/broken.xml.gz";
    byte[] broken = new byte[] {(byte) 0x1f, (byte) 0x8b, 0x00, 0x01};
    responses.put(url, new HttpFetchResult(
        url, URI.create(url), 200, "", broken, "application/x-gzip", null, Map.of(),
        Instant.now(), Duration.ofMillis(3), null, null
    ));

    List<SitemapRecord> records = service.discover("https://example.com/", List.of(url));

    assertEquals("gzip_decode_error", records.get(0).errorMessage());
    assertEquals(SitemapKind.UNKNOWN, records.get(0).kind());
  }

  @Test
  void extractKeepsSameSiteHttpUrlsUpToCap() {
    properties.getSitemap().setMaxFrontierUrls(3);
    SitemapRecord record = new SitemapRecord(
        0, null, "https://example.com/sitemap.xml", SitemapProvenance.ROBOTS_TXT, SitemapKind.URLSET,
        "", 200, 5,
        List.of(
            entry("https://example.com/a"),
            entry("https://www.example.com/b"),
            entry("https://cdn.other.com/c"),
            entry("ftp://example.com/file"),
            entry("https://example.com/a"),
            entry("https://example.com/d"),
            entry("https://example.com/e")
        ),
        List.of(), null, null, null, null
    );

    List<String> urls = service.extractUrlsForCrawling(List.of(record), "https://example.com/");

    assertThat(urls).containsExactly("https://example.com/a", "https://www.example.com/b", "https://example.com/d");
  }

  private static SitemapUrlEntry entry(String loc) {
    return new SitemapUrlEntry(loc, null, null, null);
  }

  private static String urlset(String... locs) {
    StringBuilder sb = new StringBuilder("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
    for (String loc : locs) {
      sb.append("<url><loc>").append(loc).append("</loc></url>");
    }
    return sb.append("</urlset>").toString();
  }

  private static String index(String... locs) {
    StringBuilder sb = new StringBuilder("<sitemapindex xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
    for (String loc : locs) {
      sb.append("<sitemap><loc>").append(loc).append("</loc></sitemap>");
    }
    return sb.append("</sitemapindex>").toString();
  }

  private static HttpFetchResult xml(String url, String body) {
    return new HttpFetchResult(
        url,
        URI.create(url),
        200,
        body,
        body.getBytes(StandardCharsets.UTF_8),
        "application/xml",
        null,
        Map.of(),
        Instant.now(),
        Duration.ofMillis(8),
        null,
        null
    );
  }

  private static HttpFetchResult status(String url, int status, String body) {
    return new HttpFetchResult(
        url, URI.create(url), status, body, body.getBytes(StandardCharsets.UTF_8), "text/html", null, Map.of(),
        Instant.now(), Duration.ofMillis(4), null, null
    );
  }

  private static byte[] gzip(String content) throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(content.getBytes(StandardCharsets.UTF_8));
    }
    return out.toByteArray();
  }
}
