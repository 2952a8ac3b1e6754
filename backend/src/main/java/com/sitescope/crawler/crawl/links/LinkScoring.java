package com.sitescope.crawler.crawl.links;

import com.sitescope.crawler.crawl.model.LinkEdge;
import com.sitescope.crawler.crawl.model.LinkType;
import com.sitescope.crawler.crawl.model.PageLinkMetrics;
import com.sitescope.crawler.crawl.model.PageRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Full recomputation of per-page link aggregates from stored edges. Inbound edges are
 * internal edges whose target resolved to the page; outbound edges are all edges the page
 * is the source of.
 */
public final class LinkScoring {
    private static final double INLINK_WEIGHT = 0.8;
    private static final double OUTLINK_WEIGHT = 0.2;

    private LinkScoring() {
    }

    public static double linkScore(int inlinks, int outlinks) {
        return Math.log(inlinks + 1) * INLINK_WEIGHT + Math.log(outlinks + 1) * OUTLINK_WEIGHT;
    }

    public static double percentOfTotal(int inlinks, int totalPages) {
        return totalPages > 0 ? (double) inlinks / totalPages * 100 : 0;
    }

    public static List<PageLinkMetrics> compute(List<PageRef> pages, List<LinkEdge> edges) {
        Map<Long, List<LinkEdge>> inbound = new HashMap<>();
        Map<Long, List<LinkEdge>> outbound = new HashMap<>();
        for (LinkEdge edge : edges) {
            if (edge.fromPageId() != null) {
                outbound.computeIfAbsent(edge.fromPageId(), id -> new ArrayList<>()).add(edge);
            }
            if (edge.type() == LinkType.INTERNAL && edge.toPageId() != null) {
                inbound.computeIfAbsent(edge.toPageId(), id -> new ArrayList<>()).add(edge);
            }
        }

        int totalPages = pages.size();
        List<PageLinkMetrics> metrics = new ArrayList<>(totalPages);
        for (PageRef page : pages) {
            List<LinkEdge> in = inbound.getOrDefault(page.id(), List.of());
            List<LinkEdge> out = outbound.getOrDefault(page.id(), List.of());

            Set<String> inSources = new HashSet<>();
            in.forEach(edge -> inSources.add(edge.fromAddress()));
            Set<String> outTargets = new HashSet<>();
            Set<String> externalTargets = new HashSet<>();
            int externalOutlinks = 0;
            for (LinkEdge edge : out) {
                outTargets.add(edge.toAddress());
                if (edge.type() == LinkType.EXTERNAL) {
                    externalOutlinks++;
                    externalTargets.add(edge.toAddress());
                }
            }
            metrics.add(new PageLinkMetrics(
                page.id(),
                in.size(),
                (int) inSources.stream().filter(Objects::nonNull).count(),
                out.size(),
                (int) outTargets.stream().filter(Objects::nonNull).count(),
                externalOutlinks,
                externalTargets.size(),
                linkScore(in.size(), out.size()),
                percentOfTotal(in.size(), totalPages)
            ));
        }
        return metrics;
    }
}
