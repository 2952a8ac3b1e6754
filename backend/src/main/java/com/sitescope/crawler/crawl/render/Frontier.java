package com.sitescope.crawler.crawl.render;

import java.util.Collection;

public interface Frontier {

    /**
     * Queues URLs for fetching in this run.
     *
     * @return how many of them were new to the run
     */
    int enqueue(Collection<String> urls);
}
