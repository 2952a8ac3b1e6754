package com.sitescope.crawler.crawl.render;

import org.jsoup.nodes.Document;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A fetched page as the engine saw it. {@code loadedUrl} is the URL after redirects;
 * {@code screenshot} is null when the engine cannot capture one.
 */
public record RenderedPage(
    String requestedUrl,
    String loadedUrl,
    int statusCode,
    Map<String, List<String>> headers,
    String html,
    Document document,
    Duration responseTime,
    byte[] screenshot
) {
    public String header(String name) {
        List<String> values = headerValues(name);
        return values.isEmpty() ? null : String.join("; ", values);
    }

    public List<String> headerValues(String name) {
        if (headers == null || name == null) {
            return List.of();
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(wanted) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    public String urlForProcessing() {
        return loadedUrl != null && !loadedUrl.isBlank() ? loadedUrl : requestedUrl;
    }
}
