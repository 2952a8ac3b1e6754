package com.sitescope.crawler.crawl.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hosts accepted as the job's own site. The first successfully fetched page pins the
 * requested host and the host it redirected to as equivalent, so a bare-domain to www
 * redirect does not turn the rest of the site external.
 */
public class DomainState {
    private final Set<String> validHosts = new LinkedHashSet<>();
    private String originalHost;
    private String resolvedHost;

    public DomainState(String jobHost) {
        if (jobHost != null && !jobHost.isBlank()) {
            validHosts.add(jobHost.toLowerCase(Locale.ROOT));
        }
    }

    public boolean isInitialized() {
        return originalHost != null;
    }

    public void recordFirstFetch(String requestedUrl, String loadedUrl) {
        if (isInitialized()) {
            return;
        }
        String requested = UrlIdentity.hostOf(requestedUrl);
        String loaded = UrlIdentity.hostOf(loadedUrl);
        if (requested == null) {
            return;
        }
        originalHost = requested;
        resolvedHost = loaded == null ? requested : loaded;
        validHosts.add(originalHost);
        validHosts.add(resolvedHost);
    }

    public boolean isValidHost(String host) {
        return host != null && validHosts.contains(host.toLowerCase(Locale.ROOT));
    }

    public void addValidHost(String host) {
        if (host != null && !host.isBlank()) {
            validHosts.add(host.toLowerCase(Locale.ROOT));
        }
    }

    public Set<String> validHosts() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(validHosts));
    }

    public String originalHost() {
        return originalHost;
    }

    public String resolvedHost() {
        return resolvedHost;
    }
}
