package com.sitescope.crawler.crawl.persistence;

import com.sitescope.crawler.crawl.model.LinkEdge;
import com.sitescope.crawler.crawl.model.LinkEdgeInsert;
import com.sitescope.crawler.crawl.model.LinkType;
import com.sitescope.crawler.crawl.model.PageData;
import com.sitescope.crawler.crawl.model.PageLinkMetrics;
import com.sitescope.crawler.crawl.model.PageRef;
import com.sitescope.crawler.crawl.model.SitemapRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Page, edge, external-link and sitemap storage for crawl jobs.
 */
@Repository
public class CrawlJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Stores a page record.
     *
     * @return the stored page, or null when the job already has a page at this address
     */
    public PageRef insertPage(String jobId, PageData page, String postType) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("address", page.address())
            .addValue("statusCode", page.statusCode())
            .addValue("status", page.status())
            .addValue("contentType", page.contentType())
            .addValue("indexability", page.indexability())
            .addValue("postType", postType)
            .addValue("title", page.title())
            .addValue("metaDescription", page.metaDescription())
            .addValue("metaKeywords", page.metaKeywords())
            .addValue("metaRobots", page.metaRobots())
            .addValue("h1", page.h1())
            .addValue("h2Tags", toJson(page.h2Tags()))
            .addValue("h3Tags", toJson(page.h3Tags()))
            .addValue("canonicalUrl", page.canonicalUrl())
            .addValue("relNext", page.relNext())
            .addValue("relPrev", page.relPrev())
            .addValue("amphtmlLink", page.amphtmlLink())
            .addValue("mobileAlternateLink", page.mobileAlternateLink())
            .addValue("language", page.language())
            .addValue("linkCount", page.linkCount())
            .addValue("imageCount", page.imageCount())
            .addValue("sizeBytes", page.sizeBytes())
            .addValue("transferredBytes", page.transferredBytes())
            .addValue("co2Mg", page.co2Mg())
            .addValue("carbonRating", page.carbonRating())
            .addValue("responseTimeMs", page.responseTimeMs())
            .addValue("wordCount", page.wordCount())
            .addValue("sentenceCount", page.sentenceCount())
            .addValue("avgWordsPerSentence", page.avgWordsPerSentence())
            .addValue("flesch", page.fleschReadingEaseScore())
            .addValue("readability", page.readability())
            .addValue("textRatio", page.textRatio())
            .addValue("crawlDepth", page.crawlDepth())
            .addValue("folderDepth", page.folderDepth())
            .addValue("lastModified", toTimestamp(page.lastModified()))
            .addValue("cookies", page.cookies())
            .addValue("urlEncodedAddress", page.urlEncodedAddress())
            .addValue("htmlContent", page.htmlContent())
            .addValue("screenshotUrl", page.screenshotUrl())
            .addValue("crawledAt", toTimestamp(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO crawl_pages (
                        job_id, address, status_code, status, content_type, indexability, post_type,
                        title, meta_description, meta_keywords, meta_robots, h1, h2_tags, h3_tags,
                        canonical_url, rel_next, rel_prev, amphtml_link, mobile_alternate_link, language,
                        link_count, image_count, size_bytes, transferred_bytes, co2_mg, carbon_rating,
                        response_time_ms, word_count, sentence_count, avg_words_per_sentence,
                        flesch_reading_ease_score, readability, text_ratio, crawl_depth, folder_depth,
                        last_modified, cookies, url_encoded_address, html_content, screenshot_url, crawled_at
                    )
                    VALUES (
                        :jobId, :address, :statusCode, :status, :contentType, :indexability, :postType,
                        :title, :metaDescription, :metaKeywords, :metaRobots, :h1, :h2Tags, :h3Tags,
                        :canonicalUrl, :relNext, :relPrev, :amphtmlLink, :mobileAlternateLink, :language,
                        :linkCount, :imageCount, :sizeBytes, :transferredBytes, :co2Mg, :carbonRating,
                        :responseTimeMs, :wordCount, :sentenceCount, :avgWordsPerSentence,
                        :flesch, :readability, :textRatio, :crawlDepth, :folderDepth,
                        :lastModified, :cookies, :urlEncodedAddress, :htmlContent, :screenshotUrl, :crawledAt
                    )
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        } catch (DuplicateKeyException e) {
            log.debug("Page already stored jobId={} address={}", jobId, page.address());
            return null;
        }
        Number key = keyHolder.getKey();
        return key == null ? null : new PageRef(key.longValue(), page.address());
    }

    public Set<String> findPageAddresses(String jobId) {
        List<String> rows = jdbc.query(
            "SELECT address FROM crawl_pages WHERE job_id = :jobId ORDER BY id",
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> rs.getString("address")
        );
        return new LinkedHashSet<>(rows);
    }

    public int countPages(String jobId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_pages WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public List<PageRef> findPageRefs(String jobId) {
        return jdbc.query(
            "SELECT id, address FROM crawl_pages WHERE job_id = :jobId ORDER BY id",
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new PageRef(rs.getLong("id"), rs.getString("address"))
        );
    }

    public long getOrCreateExternalLink(String jobId, String address) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("address", address);
        Long existing = findExternalLinkId(params);
        if (existing != null) {
            return existing;
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO external_links (job_id, address, status)
                    VALUES (:jobId, :address, 'Not Checked')
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
            Number key = keyHolder.getKey();
            if (key != null) {
                return key.longValue();
            }
        } catch (DuplicateKeyException ignored) {
            // concurrent insert of the same address; read it back below
        }
        Long created = findExternalLinkId(params);
        if (created == null) {
            throw new IllegalStateException("External link missing after insert: " + address);
        }
        return created;
    }

    public void insertEdges(String jobId, List<LinkEdgeInsert> edges) {
        if (edges == null || edges.isEmpty()) {
            return;
        }
        Timestamp now = toTimestamp(Instant.now());
        MapSqlParameterSource[] batch = edges.stream()
            .map(edge -> new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("type", edge.type().dbValue())
                .addValue("fromPageId", edge.fromPageId())
                .addValue("toExternalLinkId", edge.toExternalLinkId())
                .addValue("fromAddress", edge.fromAddress())
                .addValue("toAddress", edge.toAddress())
                .addValue("anchorText", edge.link().anchorText())
                .addValue("altText", edge.link().altText())
                .addValue("follow", edge.link().follow())
                .addValue("target", edge.link().target())
                .addValue("rel", edge.link().rel())
                .addValue("position", edge.link().position())
                .addValue("origin", edge.link().origin())
                .addValue("now", now))
            .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO link_edges (
                    job_id, type, from_page_id, to_external_link_id, from_address, to_address,
                    anchor_text, alt_text, follow, target, rel, link_position, link_origin, created_at
                )
                VALUES (
                    :jobId, :type, :fromPageId, :toExternalLinkId, :fromAddress, :toAddress,
                    :anchorText, :altText, :follow, :target, :rel, :position, :origin, :now
                )
                """,
            batch
        );
    }

    /**
     * Points internal edges at the page stored for their target address, where one exists.
     */
    public int resolveInternalTargets(String jobId) {
        return jdbc.update(
            """
                UPDATE link_edges
                SET to_page_id = (
                    SELECT p.id
                    FROM crawl_pages p
                    WHERE p.job_id = link_edges.job_id
                      AND p.address = link_edges.to_address
                )
                WHERE job_id = :jobId
                  AND type = 'internal'
                """,
            new MapSqlParameterSource("jobId", jobId)
        );
    }

    public List<LinkEdge> findEdges(String jobId) {
        return jdbc.query(
            """
                SELECT id, type, from_page_id, to_page_id, to_external_link_id, from_address, to_address
                FROM link_edges
                WHERE job_id = :jobId
                ORDER BY id
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new LinkEdge(
                rs.getLong("id"),
                LinkType.fromDbValue(rs.getString("type")),
                rs.getObject("from_page_id", Long.class),
                rs.getObject("to_page_id", Long.class),
                rs.getObject("to_external_link_id", Long.class),
                rs.getString("from_address"),
                rs.getString("to_address")
            )
        );
    }

    public void updatePageLinkMetrics(List<PageLinkMetrics> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return;
        }
        MapSqlParameterSource[] batch = metrics.stream()
            .map(m -> new MapSqlParameterSource()
                .addValue("pageId", m.pageId())
                .addValue("inlinks", m.inlinks())
                .addValue("uniqueInlinks", m.uniqueInlinks())
                .addValue("outlinks", m.outlinks())
                .addValue("uniqueOutlinks", m.uniqueOutlinks())
                .addValue("externalOutlinks", m.externalOutlinks())
                .addValue("uniqueExternalOutlinks", m.uniqueExternalOutlinks())
                .addValue("linkScore", m.linkScore())
                .addValue("percentOfTotal", m.percentOfTotal()))
            .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                UPDATE crawl_pages
                SET inlinks = :inlinks,
                    unique_inlinks = :uniqueInlinks,
                    outlinks = :outlinks,
                    unique_outlinks = :uniqueOutlinks,
                    external_outlinks = :externalOutlinks,
                    unique_external_outlinks = :uniqueExternalOutlinks,
                    link_score = :linkScore,
                    percent_of_total = :percentOfTotal
                WHERE id = :pageId
                """,
            batch
        );
    }

    public List<PageLinkMetrics> findPageLinkMetrics(String jobId) {
        return jdbc.query(
            """
                SELECT id, inlinks, unique_inlinks, outlinks, unique_outlinks, external_outlinks,
                       unique_external_outlinks, link_score, percent_of_total
                FROM crawl_pages
                WHERE job_id = :jobId
                ORDER BY id
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new PageLinkMetrics(
                rs.getLong("id"),
                rs.getInt("inlinks"),
                rs.getInt("unique_inlinks"),
                rs.getInt("outlinks"),
                rs.getInt("unique_outlinks"),
                rs.getInt("external_outlinks"),
                rs.getInt("unique_external_outlinks"),
                rs.getDouble("link_score"),
                rs.getDouble("percent_of_total")
            )
        );
    }

    public int recomputeExternalInlinks(String jobId) {
        return jdbc.update(
            """
                UPDATE external_links
                SET inlinks = (
                    SELECT COUNT(*)
                    FROM link_edges e
                    WHERE e.to_external_link_id = external_links.id
                )
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource("jobId", jobId)
        );
    }

    /**
     * Stores a discovery arena in order, so every parent row exists before its children.
     *
     * @return database ids keyed by arena id
     */
    public Map<Integer, Long> saveSitemaps(String jobId, List<SitemapRecord> sitemaps) {
        Map<Integer, Long> idsByArenaId = new HashMap<>();
        for (SitemapRecord sitemap : sitemaps) {
            Long parentId = sitemap.parentId() == null ? null : idsByArenaId.get(sitemap.parentId());
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("parentId", parentId)
                .addValue("url", sitemap.url())
                .addValue("provenance", sitemap.provenance().dbValue())
                .addValue("kind", sitemap.kind().dbValue())
                .addValue("content", sitemap.content())
                .addValue("statusCode", sitemap.statusCode())
                .addValue("responseTimeMs", sitemap.responseTimeMs())
                .addValue("urlCount", sitemap.urlCount())
                .addValue("urls", toJson(sitemap.urls()))
                .addValue("childSitemapUrls", toJson(sitemap.childSitemapUrls()))
                .addValue("lastmod", sitemap.lastmod())
                .addValue("changefreq", sitemap.changefreq())
                .addValue("priority", sitemap.priority())
                .addValue("errorMessage", sitemap.errorMessage());
            KeyHolder keyHolder = new GeneratedKeyHolder();
            Long id;
            try {
                jdbc.update(
                    """
                        INSERT INTO sitemaps (
                            job_id, parent_id, url, provenance, kind, content, status_code,
                            response_time_ms, url_count, urls, child_sitemap_urls, lastmod,
                            changefreq, priority, error_message
                        )
                        VALUES (
                            :jobId, :parentId, :url, :provenance, :kind, :content, :statusCode,
                            :responseTimeMs, :urlCount, :urls, :childSitemapUrls, :lastmod,
                            :changefreq, :priority, :errorMessage
                        )
                        """,
                    params,
                    keyHolder,
                    new String[] {"id"}
                );
                Number key = keyHolder.getKey();
                id = key == null ? null : key.longValue();
            } catch (DuplicateKeyException e) {
                // a resumed job rediscovers sitemaps stored by the earlier attempt
                id = jdbc.queryForObject(
                    "SELECT id FROM sitemaps WHERE job_id = :jobId AND url = :url",
                    params,
                    Long.class
                );
            }
            if (id != null) {
                idsByArenaId.put(sitemap.id(), id);
            }
        }
        return idsByArenaId;
    }

    private Long findExternalLinkId(MapSqlParameterSource params) {
        List<Long> rows = jdbc.query(
            "SELECT id FROM external_links WHERE job_id = :jobId AND address = :address",
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize crawl data", e);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
