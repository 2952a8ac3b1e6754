package com.sitescope.crawler.crawl.notify;

import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Posts {@code {"jobId": ...}} to a configured URL. A blank URL disables the notifier.
 */
abstract class WebhookNotifier implements JobCompletionNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    WebhookNotifier(PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    protected abstract String webhookUrl();

    @Override
    public boolean isEnabled() {
        String url = webhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public void notifyCompleted(String jobId) {
        if (!isEnabled()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(Map.of("jobId", jobId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification payload", e);
        }
        HttpFetchResult result = httpClient.postJson(webhookUrl().trim(), payload, "application/json");
        if (!result.isSuccessful()) {
            throw new IllegalStateException(name() + " webhook failed: " + result.describeFailure());
        }
        log.info("{} notified jobId={} status={}", name(), jobId, result.statusCode());
    }
}
