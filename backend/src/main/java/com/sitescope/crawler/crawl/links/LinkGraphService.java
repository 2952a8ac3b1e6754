package com.sitescope.crawler.crawl.links;

import com.sitescope.crawler.crawl.model.LinkCandidate;
import com.sitescope.crawler.crawl.model.LinkEdge;
import com.sitescope.crawler.crawl.model.LinkEdgeInsert;
import com.sitescope.crawler.crawl.model.LinkType;
import com.sitescope.crawler.crawl.model.PageLinkMetrics;
import com.sitescope.crawler.crawl.model.PageRef;
import com.sitescope.crawler.crawl.persistence.CrawlJdbcRepository;
import com.sitescope.crawler.crawl.persistence.PersistenceRetry;
import com.sitescope.crawler.crawl.util.DomainState;
import com.sitescope.crawler.crawl.util.UrlIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class LinkGraphService {
    private static final Logger log = LoggerFactory.getLogger(LinkGraphService.class);

    private final CrawlJdbcRepository repository;
    private final PersistenceRetry retry;

    public LinkGraphService(CrawlJdbcRepository repository, PersistenceRetry retry) {
        this.repository = repository;
        this.retry = retry;
    }

    /**
     * Stores one edge per anchor on {@code source} whose href carries a scheme. Same-site http(s)
     * anchors become internal edges to their normalized address; everything else, {@code mailto:}
     * and {@code tel:} links included, becomes an external edge to the raw href, backed by the
     * job's external-link aggregate for that address. Hrefs longer than
     * {@link UrlIdentity#MAX_ADDRESS_LENGTH} are not stored.
     *
     * @return normalized addresses of the internal targets, in page order
     */
    public List<String> recordEdges(
        String jobId,
        String jobUrl,
        PageRef source,
        List<LinkCandidate> links,
        DomainState domainState,
        boolean ignoreQuery
    ) {
        List<LinkEdgeInsert> edges = new ArrayList<>(links.size());
        List<String> internalTargets = new ArrayList<>();
        for (LinkCandidate link : links) {
            String href = link.href();
            if (!UrlIdentity.hasScheme(href) || href.length() > UrlIdentity.MAX_ADDRESS_LENGTH) {
                continue;
            }
            if (UrlIdentity.isHttpUrl(href) && UrlIdentity.isSameSite(href, jobUrl, domainState)) {
                String target = UrlIdentity.normalize(href, ignoreQuery);
                if (target.length() > UrlIdentity.MAX_ADDRESS_LENGTH) {
                    continue;
                }
                edges.add(new LinkEdgeInsert(LinkType.INTERNAL, source.id(), null, source.address(), target, link));
                internalTargets.add(target);
            } else {
                long externalId = retry.execute(
                    "getOrCreateExternalLink",
                    () -> repository.getOrCreateExternalLink(jobId, href)
                );
                edges.add(new LinkEdgeInsert(LinkType.EXTERNAL, source.id(), externalId, source.address(), href, link));
            }
        }
        retry.run("insertEdges", () -> repository.insertEdges(jobId, edges));
        log.debug(
            "Recorded edges jobId={} from={} total={} internal={}",
            jobId,
            source.address(),
            edges.size(),
            internalTargets.size()
        );
        return internalTargets;
    }

    /**
     * Recomputes every page and external-link aggregate of the job from its edges.
     * Safe to run more than once.
     *
     * @return number of pages scored
     */
    public int finalizeJob(String jobId) {
        int resolved = retry.execute("resolveInternalTargets", () -> repository.resolveInternalTargets(jobId));
        List<PageRef> pages = retry.execute("findPageRefs", () -> repository.findPageRefs(jobId));
        List<LinkEdge> edges = retry.execute("findEdges", () -> repository.findEdges(jobId));

        List<PageLinkMetrics> metrics = LinkScoring.compute(pages, edges);
        retry.run("updatePageLinkMetrics", () -> repository.updatePageLinkMetrics(metrics));
        int externalLinks = retry.execute("recomputeExternalInlinks", () -> repository.recomputeExternalInlinks(jobId));

        log.info(
            "Link graph finalized jobId={} pages={} edges={} internalEdges={} externalLinks={}",
            jobId,
            pages.size(),
            edges.size(),
            resolved,
            externalLinks
        );
        return pages.size();
    }
}
