package com.sitescope.crawler.crawl.sampling;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-job count of processed level-2+ pages by post type. Owned by a single crawl run.
 */
public class SamplingCounters {
    private final Map<PostType, Integer> counts = new EnumMap<>(PostType.class);

    public int get(PostType type) {
        return counts.getOrDefault(type, 0);
    }

    public int increment(PostType type) {
        return counts.merge(type, 1, Integer::sum);
    }

    public Map<PostType, Integer> snapshot() {
        return Map.copyOf(counts);
    }
}
