package com.sitescope.crawler.crawl.persistence;

import com.sitescope.crawler.crawl.model.CrawlJob;
import com.sitescope.crawler.crawl.model.CrawlJobRequest;
import com.sitescope.crawler.crawl.model.CrawlJobStatus;
import com.sitescope.crawler.crawl.model.RobotsResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public class CrawlJobRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobRepository.class);
    private static final String JOB_COLUMNS = """
        id, url, max_pages, take_screenshots, crawl_sitemap, sampled_crawl, ignore_url_parameters,
        email_verification_required, email, status, can_continue, pages_crawled, pages_remaining,
        total_unique_pages_found, created_at, started_at, completed_at, last_crawled_url, error_message
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    /**
     * Creates a job the way the API layer does. Jobs that need email verification start in
     * {@code waiting_verification} and are not eligible for polling until verified.
     */
    public String insertJob(CrawlJobRequest request) {
        String id = UUID.randomUUID().toString();
        CrawlJobStatus status = request.emailVerificationRequired()
            ? CrawlJobStatus.WAITING_VERIFICATION
            : CrawlJobStatus.PENDING;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("url", request.url())
            .addValue("maxPages", request.maxPages())
            .addValue("takeScreenshots", request.takeScreenshots())
            .addValue("crawlSitemap", request.crawlSitemap())
            .addValue("sampledCrawl", request.sampledCrawl())
            .addValue("ignoreUrlParameters", request.ignoreUrlParameters())
            .addValue("emailVerificationRequired", request.emailVerificationRequired())
            .addValue("email", request.email())
            .addValue("status", status.dbValue())
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                INSERT INTO crawl_jobs (
                    id, url, max_pages, take_screenshots, crawl_sitemap, sampled_crawl,
                    ignore_url_parameters, email_verification_required, email, status,
                    can_continue, created_at, updated_at
                )
                VALUES (
                    :id, :url, :maxPages, :takeScreenshots, :crawlSitemap, :sampledCrawl,
                    :ignoreUrlParameters, :emailVerificationRequired, :email, :status,
                    TRUE, :now, :now
                )
                """,
            params
        );
        return id;
    }

    public CrawlJob findJob(String jobId) {
        List<CrawlJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM crawl_jobs WHERE id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            jobRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Oldest pending or running job that may continue, or null.
     */
    public CrawlJob findNextEligibleJob() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("statuses", List.of(CrawlJobStatus.PENDING.dbValue(), CrawlJobStatus.RUNNING.dbValue()));
        List<CrawlJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM crawl_jobs
                WHERE status IN (:statuses)
                  AND can_continue = TRUE
                ORDER BY created_at ASC, id ASC
                LIMIT 1
                """,
            params,
            jobRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void markRunning(String jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", CrawlJobStatus.RUNNING.dbValue())
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    started_at = COALESCE(started_at, :now),
                    pages_remaining = COALESCE(pages_remaining, max_pages),
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public void saveRobots(String jobId, RobotsResult robots) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("robotsUrl", robots.url())
            .addValue("content", robots.content())
            .addValue("status", robots.statusCode())
            .addValue("responseMs", robots.responseTimeMs())
            .addValue("rules", toJson(robots.directives()))
            .addValue("sitemapUrls", toJson(robots.sitemapUrls()))
            .addValue("error", robots.errorMessage())
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET robots_txt_url = :robotsUrl,
                    robots_txt_content = :content,
                    robots_txt_status = :status,
                    robots_txt_response_ms = :responseMs,
                    robots_txt_rules = :rules,
                    robots_sitemap_urls = :sitemapUrls,
                    robots_txt_error = :error,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public void saveSitemapSummary(String jobId, int sitemapCount, int sitemapUrlCount) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("sitemapCount", sitemapCount)
            .addValue("sitemapUrlCount", sitemapUrlCount)
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET sitemap_count = :sitemapCount,
                    sitemap_url_count = :sitemapUrlCount,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public String findRobotsRulesJson(String jobId) {
        List<String> rows = jdbc.query(
            "SELECT robots_txt_rules FROM crawl_jobs WHERE id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> rs.getString("robots_txt_rules")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Progress counters derive from the stored page count, so re-processing a page never
     * double counts.
     */
    public void updateProgress(String jobId, int pageCount, String lastCrawledUrl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("count", pageCount)
            .addValue("lastCrawledUrl", lastCrawledUrl)
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET pages_crawled = :count,
                    total_unique_pages_found = :count,
                    pages_remaining = max_pages - :count,
                    last_crawled_url = :lastCrawledUrl,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public void markCompleted(String jobId, int pageCount) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", CrawlJobStatus.COMPLETED.dbValue())
            .addValue("count", pageCount)
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    completed_at = :now,
                    pages_crawled = :count,
                    pages_remaining = 0,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public void markFailed(String jobId, String errorMessage) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", CrawlJobStatus.FAILED.dbValue())
            .addValue("errorMessage", truncate(errorMessage, 4000))
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    error_message = :errorMessage,
                    completed_at = :now,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public void setCanContinue(String jobId, boolean canContinue) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("canContinue", canContinue)
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            "UPDATE crawl_jobs SET can_continue = :canContinue, updated_at = :now WHERE id = :jobId",
            params
        );
    }

    private RowMapper<CrawlJob> jobRowMapper() {
        return (rs, rowNum) -> {
            int maxPages = rs.getInt("max_pages");
            Integer pagesRemaining = (Integer) rs.getObject("pages_remaining");
            return new CrawlJob(
                rs.getString("id"),
                rs.getString("url"),
                maxPages,
                rs.getBoolean("take_screenshots"),
                rs.getBoolean("crawl_sitemap"),
                rs.getBoolean("sampled_crawl"),
                rs.getBoolean("ignore_url_parameters"),
                rs.getBoolean("email_verification_required"),
                rs.getString("email"),
                CrawlJobStatus.fromDbValue(rs.getString("status")),
                rs.getBoolean("can_continue"),
                rs.getInt("pages_crawled"),
                pagesRemaining == null ? maxPages : pagesRemaining,
                rs.getInt("total_unique_pages_found"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getString("last_crawled_url"),
                rs.getString("error_message")
            );
        };
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize robots data", e);
            return null;
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
