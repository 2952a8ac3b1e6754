package com.sitescope.crawler.crawl.page;

import java.util.Arrays;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Content, readability and footprint formulas used when a page is stored.
 */
public final class PageMetrics {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern NON_VOWEL = Pattern.compile("[^aeiouAEIOU]");
    private static final double CO2_MG_PER_BYTE = 0.5;
    private static final Map<Integer, String> STATUS_TEXT = Map.of(
        200, "OK",
        301, "Moved Permanently",
        302, "Found",
        404, "Not Found",
        500, "Internal Server Error"
    );

    private PageMetrics() {
    }

    public static TextStats analyzeText(String text) {
        if (text == null || text.isBlank()) {
            return new TextStats(0, 0, 0, 0);
        }
        String[] words = Arrays.stream(WHITESPACE.split(text)).filter(word -> !word.isEmpty()).toArray(String[]::new);
        long sentences = Arrays.stream(SENTENCE_END.split(text)).filter(s -> !s.trim().isEmpty()).count();
        double avgWordsPerSentence = sentences > 0 ? (double) words.length / sentences : 0;

        double flesch = 0;
        if (sentences > 0 && words.length > 0) {
            long syllables = 0;
            for (String word : words) {
                syllables += Math.max(1, NON_VOWEL.matcher(word).replaceAll("").length());
            }
            double avgSyllablesPerWord = (double) syllables / words.length;
            flesch = 206.835 - (1.015 * avgWordsPerSentence) - (84.6 * avgSyllablesPerWord);
        }
        return new TextStats(words.length, (int) sentences, avgWordsPerSentence, flesch);
    }

    public static String readabilityLabel(double fleschScore) {
        if (fleschScore >= 90) {
            return "Very Easy";
        }
        if (fleschScore >= 80) {
            return "Easy";
        }
        if (fleschScore >= 70) {
            return "Fairly Easy";
        }
        if (fleschScore >= 60) {
            return "Standard";
        }
        if (fleschScore >= 50) {
            return "Fairly Difficult";
        }
        if (fleschScore >= 30) {
            return "Difficult";
        }
        return "Very Difficult";
    }

    public static double co2Mg(long transferredBytes) {
        return transferredBytes * CO2_MG_PER_BYTE;
    }

    public static String carbonRating(long transferredBytes) {
        if (transferredBytes < 50_000) {
            return "A+";
        }
        if (transferredBytes < 100_000) {
            return "A";
        }
        if (transferredBytes < 200_000) {
            return "B";
        }
        if (transferredBytes < 300_000) {
            return "C";
        }
        if (transferredBytes < 500_000) {
            return "D";
        }
        if (transferredBytes < 1_000_000) {
            return "E";
        }
        return "F";
    }

    public static String statusText(int statusCode) {
        return STATUS_TEXT.getOrDefault(statusCode, "Unknown");
    }

    /**
     * Visible text length as a percentage of the HTML length.
     */
    public static double textRatio(String text, String html) {
        if (text == null || html == null || html.isEmpty()) {
            return 0;
        }
        return (double) text.length() / html.length() * 100;
    }

    public record TextStats(int wordCount, int sentenceCount, double avgWordsPerSentence, double fleschReadingEaseScore) {
    }
}
