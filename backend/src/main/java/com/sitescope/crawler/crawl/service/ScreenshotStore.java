package com.sitescope.crawler.crawl.service;

import com.sitescope.crawler.config.CrawlerProperties;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Writes page screenshots under {@code crawler.storage.screenshot-dir} and returns the public
 * path they are served from.
 */
@Component
public class ScreenshotStore {
    private static final Logger log = LoggerFactory.getLogger(ScreenshotStore.class);

    private final CrawlerProperties properties;
    private final Clock clock;

    public ScreenshotStore(CrawlerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return {@code /screenshots/{jobId}/{file}}, or null when the image could not be written
     */
    public String save(String jobId, String address, byte[] image) {
        if (image == null || image.length == 0) {
            return null;
        }
        String fileName = fileName(address);
        Path directory = Paths.get(properties.getStorage().getScreenshotDir(), jobId);
        try {
            Files.createDirectories(directory);
            Files.write(directory.resolve(fileName), image);
        } catch (IOException e) {
            log.warn("Screenshot write failed jobId={} address={}", jobId, address, e);
            return null;
        }
        return "/screenshots/" + jobId + "/" + fileName;
    }

    String fileName(String address) {
        URI uri = UrlIdentity.safeUri(address);
        String host = uri == null || uri.getHost() == null ? "unknown" : uri.getHost();
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath();
        return host + "_" + path.replaceAll("[^a-zA-Z0-9]", "_") + "_" + clock.millis() + ".png";
    }
}
