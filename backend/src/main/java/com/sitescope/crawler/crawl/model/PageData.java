package com.sitescope.crawler.crawl.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything extracted from one fetched page before it is stored.
 */
public record PageData(
    String address,
    int statusCode,
    String status,
    String contentType,
    String indexability,
    String title,
    String metaDescription,
    String metaKeywords,
    String metaRobots,
    String h1,
    List<String> h2Tags,
    List<String> h3Tags,
    String canonicalUrl,
    String relNext,
    String relPrev,
    String amphtmlLink,
    String mobileAlternateLink,
    String language,
    int linkCount,
    int imageCount,
    int sizeBytes,
    int transferredBytes,
    double co2Mg,
    String carbonRating,
    long responseTimeMs,
    int wordCount,
    int sentenceCount,
    double avgWordsPerSentence,
    double fleschReadingEaseScore,
    String readability,
    double textRatio,
    int crawlDepth,
    int folderDepth,
    Instant lastModified,
    String cookies,
    String urlEncodedAddress,
    String htmlContent,
    String screenshotUrl
) {
    public PageData withScreenshotUrl(String url) {
        return new PageData(
            address, statusCode, status, contentType, indexability, title, metaDescription, metaKeywords,
            metaRobots, h1, h2Tags, h3Tags, canonicalUrl, relNext, relPrev, amphtmlLink, mobileAlternateLink,
            language, linkCount, imageCount, sizeBytes, transferredBytes, co2Mg, carbonRating, responseTimeMs,
            wordCount, sentenceCount, avgWordsPerSentence, fleschReadingEaseScore, readability, textRatio,
            crawlDepth, folderDepth, lastModified, cookies, urlEncodedAddress, htmlContent, url
        );
    }
}
