package com.sitescope.crawler.crawl.sitemap;

import com.sitescope.crawler.crawl.model.SitemapKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SitemapParserTest {

  @Test
  void parsesUrlsetEntries() {
    SitemapParser.ParsedSitemap parsed = SitemapParser.parse("""
        <?xml version="1.0" encoding="UTF-8"?>
        <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
          <url>
            <loc>https://example.com/</loc>
            <lastmod>2025-08-01</lastmod>
            <changefreq>daily</changefreq>
            <priority>1.0</priority>
          </url>
          <url>
            <loc> https://example.com/blog/post-1 </loc>
            <priority>high</priority>
          </url>
          <url>
            <lastmod>2025-08-02</lastmod>
          </url>
        </urlset>
        """);

    assertEquals(SitemapKind.URLSET, parsed.kind());
    assertThat(parsed.urls()).hasSize(2);
    assertEquals("https://example.com/blog/post-1", parsed.urls().get(1).loc());
    assertNull(parsed.urls().get(1).priority());
    assertEquals("2025-08-01", parsed.lastmod());
    assertEquals("daily", parsed.changefreq());
    assertThat(parsed.priority()).isEqualTo(1.0);
    assertThat(parsed.childSitemapUrls()).isEmpty();
  }

  @Test
  void parsesIndexChildren() {
    SitemapParser.ParsedSitemap parsed = SitemapParser.parse("""
        <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
          <sitemap><loc>https://example.com/posts.xml</loc><lastmod>2025-07-30</lastmod></sitemap>
          <sitemap><loc>https://example.com/pages.xml</loc></sitemap>
        </sitemapindex>
        """);

    assertEquals(SitemapKind.INDEX, parsed.kind());
    assertThat(parsed.childSitemapUrls())
        .containsExactly("https://example.com/posts.xml", "https://example.com/pages.xml");
    assertThat(parsed.urls()).isEmpty();
    assertEquals("2025-07-30", parsed.lastmod());
  }

  @Test
  void unrecognizedDocumentIsUnknown() {
    assertEquals(SitemapKind.UNKNOWN, SitemapParser.parse("<html><body>not found</body></html>").kind());
    assertEquals(SitemapKind.UNKNOWN, SitemapParser.parse("").kind());
    assertEquals(SitemapKind.UNKNOWN, SitemapParser.parse(null).kind());
  }
}
