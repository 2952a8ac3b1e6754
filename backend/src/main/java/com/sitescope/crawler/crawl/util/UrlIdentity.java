package com.sitescope.crawler.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL normalization and same-site checks. The normalized form is the identity key for
 * pages within a job.
 */
public final class UrlIdentity {
    /** Longest address stored for a page, link edge or external link. */
    public static final int MAX_ADDRESS_LENGTH = 4096;

    private static final Pattern NON_PAGE_EXTENSION = Pattern.compile(
        "\\.(pdf|jpg|jpeg|png|gif|webp|bmp|svg|ico|css|js|mjs|woff|woff2|ttf|otf|eot|zip|rar|gz|tgz|tar|7z|exe|dmg|mp3|mp4)$",
        Pattern.CASE_INSENSITIVE
    );

    private UrlIdentity() {
    }

    /**
     * Drops the fragment, drops the query when {@code ignoreQuery} is set, lowercases scheme and
     * host, omits default ports and removes trailing slashes from non-root paths. Input that
     * cannot be parsed as an absolute http(s) URL is returned trimmed.
     */
    public static String normalize(String url, boolean ignoreQuery) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null || uri.isOpaque()) {
            return trimmed;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = ignoreQuery ? null : uri.getRawQuery();

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null && !query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    public static String normalize(String url) {
        return normalize(url, false);
    }

    /**
     * Host-level check used to classify links: the URL belongs to the job's site when its
     * host is the job host, a host recorded in {@code domainState}, or a www/apex variant of
     * either. Equivalent hosts seen here are added to {@code domainState}.
     */
    public static boolean isSameSite(String url, String jobUrl, DomainState domainState) {
        String host = hostOf(url);
        String jobHost = hostOf(jobUrl);
        if (host == null || jobHost == null) {
            return false;
        }
        if (host.equals(jobHost)) {
            return true;
        }
        if (domainState != null && domainState.isValidHost(host)) {
            return true;
        }
        if (isWwwEquivalent(host, jobHost)) {
            if (domainState != null) {
                domainState.addValidHost(host);
            }
            return true;
        }
        if (domainState != null) {
            for (String known : domainState.validHosts()) {
                if (isWwwEquivalent(host, known)) {
                    domainState.addValidHost(host);
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Crawlable-page check: http(s) scheme, same site as the job and not a static asset.
     */
    public static boolean isInternal(String url, String jobUrl, DomainState domainState) {
        URI uri = safeUri(url);
        if (uri == null || !isHttpScheme(uri.getScheme())) {
            return false;
        }
        String path = uri.getPath();
        if (path != null && NON_PAGE_EXTENSION.matcher(path).find()) {
            return false;
        }
        return isSameSite(url, jobUrl, domainState);
    }

    public static boolean isWwwEquivalent(String hostA, String hostB) {
        if (hostA == null || hostB == null) {
            return false;
        }
        return stripWww(hostA).equals(stripWww(hostB));
    }

    /**
     * True for any parseable URI with a scheme, {@code mailto:} and {@code tel:} included.
     */
    public static boolean hasScheme(String url) {
        URI uri = safeUri(url);
        return uri != null && uri.getScheme() != null;
    }

    public static boolean isHttpUrl(String url) {
        URI uri = safeUri(url);
        return uri != null && isHttpScheme(uri.getScheme()) && uri.getHost() != null;
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static String originOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String origin = scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT);
        return port == -1 || isDefaultPort(scheme, port) ? origin : origin + ":" + port;
    }

    /**
     * Path plus query as matched against robots directives; never empty.
     */
    public static String pathAndQuery(String url) {
        URI uri = safeUri(url);
        if (uri == null) {
            return "/";
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }

    /**
     * Number of non-empty path segments; the root is level 0.
     */
    public static int pathDepth(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getPath() == null) {
            return -1;
        }
        int depth = 0;
        for (String segment : uri.getPath().split("/")) {
            if (!segment.isEmpty()) {
                depth++;
            }
        }
        return depth;
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripWww(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        return lower.startsWith("www.") ? lower.substring(4) : lower;
    }

    private static boolean isHttpScheme(String scheme) {
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
    }
}
