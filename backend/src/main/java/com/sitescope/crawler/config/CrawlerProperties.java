package com.sitescope.crawler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "SiteScope-Bot/1.0";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Scheduler scheduler = new Scheduler();
    private Robots robots = new Robots();
    private Sitemap sitemap = new Sitemap();
    private Sampling sampling = new Sampling();
    private Render render = new Render();
    private Persistence persistence = new Persistence();
    private Notifications notifications = new Notifications();
    private Storage storage = new Storage();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Sampling getSampling() {
        return sampling;
    }

    public void setSampling(Sampling sampling) {
        this.sampling = sampling;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int pollIntervalMs = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }
    }

    public static class Robots {
        private int timeoutSeconds = 10;
        private String agentToken = "sitescope-bot";
        private boolean respectDirectives = false;
        private int maxCrawlDelaySeconds = 10;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getAgentToken() {
            return agentToken == null || agentToken.isBlank() ? "*" : agentToken.trim();
        }

        public void setAgentToken(String agentToken) {
            this.agentToken = agentToken;
        }

        public boolean isRespectDirectives() {
            return respectDirectives;
        }

        public void setRespectDirectives(boolean respectDirectives) {
            this.respectDirectives = respectDirectives;
        }

        public int getMaxCrawlDelaySeconds() {
            return Math.max(0, maxCrawlDelaySeconds);
        }

        public void setMaxCrawlDelaySeconds(int maxCrawlDelaySeconds) {
            this.maxCrawlDelaySeconds = maxCrawlDelaySeconds;
        }
    }

    public static class Sitemap {
        private int maxSitemaps = 50;
        private int maxFrontierUrls = 2000;
        private int timeoutSeconds = 15;
        private int maxBytes = 10_000_000;
        private List<String> wellKnownPaths = List.of(
            "/sitemap.xml",
            "/sitemap_index.xml",
            "/sitemaps.xml",
            "/sitemap1.xml"
        );

        public int getMaxSitemaps() {
            return Math.max(1, maxSitemaps);
        }

        public void setMaxSitemaps(int maxSitemaps) {
            this.maxSitemaps = Math.max(1, maxSitemaps);
        }

        public int getMaxFrontierUrls() {
            return Math.max(0, maxFrontierUrls);
        }

        public void setMaxFrontierUrls(int maxFrontierUrls) {
            this.maxFrontierUrls = maxFrontierUrls;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxBytes() {
            return Math.max(1, maxBytes);
        }

        public void setMaxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        public List<String> getWellKnownPaths() {
            return wellKnownPaths;
        }

        public void setWellKnownPaths(List<String> wellKnownPaths) {
            this.wellKnownPaths = wellKnownPaths == null ? List.of() : List.copyOf(wellKnownPaths);
        }
    }

    public static class Sampling {
        private int perCategoryQuota = 3;

        public int getPerCategoryQuota() {
            return Math.max(1, perCategoryQuota);
        }

        public void setPerCategoryQuota(int perCategoryQuota) {
            this.perCategoryQuota = Math.max(1, perCategoryQuota);
        }
    }

    public static class Render {
        private int navigationTimeoutSeconds = 30;
        private int maxPageBytes = 5_000_000;

        public int getNavigationTimeoutSeconds() {
            return Math.max(1, navigationTimeoutSeconds);
        }

        public void setNavigationTimeoutSeconds(int navigationTimeoutSeconds) {
            this.navigationTimeoutSeconds = navigationTimeoutSeconds;
        }

        public int getMaxPageBytes() {
            return Math.max(1, maxPageBytes);
        }

        public void setMaxPageBytes(int maxPageBytes) {
            this.maxPageBytes = maxPageBytes;
        }
    }

    public static class Persistence {
        private int maxAttempts = 3;
        private long backoffMs = 1000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBackoffMs() {
            return Math.max(0, backoffMs);
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }
    }

    public static class Notifications {
        private String aiAnalysisUrl;
        private String emailReportUrl;

        public String getAiAnalysisUrl() {
            return aiAnalysisUrl;
        }

        public void setAiAnalysisUrl(String aiAnalysisUrl) {
            this.aiAnalysisUrl = aiAnalysisUrl;
        }

        public String getEmailReportUrl() {
            return emailReportUrl;
        }

        public void setEmailReportUrl(String emailReportUrl) {
            this.emailReportUrl = emailReportUrl;
        }
    }

    public static class Storage {
        private String screenshotDir = "storage/screenshots";

        public String getScreenshotDir() {
            return screenshotDir;
        }

        public void setScreenshotDir(String screenshotDir) {
            this.screenshotDir = screenshotDir;
        }
    }
}
