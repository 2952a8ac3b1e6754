package com.sitescope.crawler.crawl.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionNotificationServiceTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService notificationExecutor;
    private CrawlerProperties properties;
    private PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        httpExecutor = Executors.newFixedThreadPool(1);
        notificationExecutor = Executors.newFixedThreadPool(2);
        httpClient = new PoliteHttpClient(properties, httpExecutor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        notificationExecutor.shutdownNow();
    }

    @Test
    void postsJobIdToEnabledWebhooksOnly() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        properties.getNotifications().setAiAnalysisUrl(server.url("/ai/analyze").toString());
        properties.getNotifications().setEmailReportUrl(" ");
        CompletionNotificationService service = new CompletionNotificationService(
            List.of(
                new AiAnalysisNotifier(httpClient, objectMapper, properties),
                new EmailReportNotifier(httpClient, objectMapper, properties)
            ),
            notificationExecutor
        );

        List<Future<?>> futures = service.dispatch("job-42");
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }

        assertThat(futures).hasSize(1);
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/ai/analyze");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"jobId\":\"job-42\"}");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void failingNotifierDoesNotAffectOthers() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(200));
        properties.getNotifications().setAiAnalysisUrl(server.url("/ai").toString());
        properties.getNotifications().setEmailReportUrl(server.url("/email").toString());
        CompletionNotificationService service = new CompletionNotificationService(
            List.of(
                new AiAnalysisNotifier(httpClient, objectMapper, properties),
                new EmailReportNotifier(httpClient, objectMapper, properties)
            ),
            notificationExecutor
        );

        List<Future<?>> futures = service.dispatch("job-7");
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }

        assertThat(futures).hasSize(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void webhookFailureIsReportedByNotifier() {
        server.enqueue(new MockResponse().setResponseCode(502));
        properties.getNotifications().setEmailReportUrl(server.url("/email").toString());
        EmailReportNotifier notifier = new EmailReportNotifier(httpClient, objectMapper, properties);

        assertThatThrownBy(() -> notifier.notifyCompleted("job-9"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("email-report");
    }

    @Test
    void rejectedSubmissionIsDropped() {
        properties.getNotifications().setAiAnalysisUrl(server.url("/ai").toString());
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        CompletionNotificationService service = new CompletionNotificationService(
            List.of(new AiAnalysisNotifier(httpClient, objectMapper, properties)),
            closed
        );

        assertThat(service.dispatch("job-1")).isEmpty();
    }
}
