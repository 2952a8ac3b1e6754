package com.sitescope.crawler.crawl.notify;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class EmailReportNotifier extends WebhookNotifier {
    private final CrawlerProperties properties;

    public EmailReportNotifier(PoliteHttpClient httpClient, ObjectMapper objectMapper, CrawlerProperties properties) {
        super(httpClient, objectMapper);
        this.properties = properties;
    }

    @Override
    public String name() {
        return "email-report";
    }

    @Override
    protected String webhookUrl() {
        return properties.getNotifications().getEmailReportUrl();
    }
}
