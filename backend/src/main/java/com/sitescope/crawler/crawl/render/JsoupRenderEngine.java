package com.sitescope.crawler.crawl.render;

import com.sitescope.crawler.crawl.http.PoliteHttpClient;
import com.sitescope.crawler.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static-HTML render engine: plain HTTP fetch plus jsoup parsing, no script execution and no
 * screenshots. Requests are handled one at a time in FIFO order.
 */
@Component
public class JsoupRenderEngine implements RenderEngine {
    private static final Logger log = LoggerFactory.getLogger(JsoupRenderEngine.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";

    private final PoliteHttpClient httpClient;

    public JsoupRenderEngine(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public void run(List<String> seeds, RenderOptions options, PageHandler pageHandler, FailureHandler failureHandler) {
        QueueFrontier frontier = new QueueFrontier();
        frontier.enqueue(seeds);
        int handled = 0;
        while (!frontier.queue.isEmpty() && handled < options.maxRequests()) {
            String url = frontier.queue.poll();
            handled++;

            HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT, options.maxPageBytes(), options.navigationTimeout());
            if (!fetch.hasResponse()) {
                failureHandler.onFailure(url, fetch.describeFailure());
                continue;
            }
            if (fetch.statusCode() >= 500) {
                failureHandler.onFailure(url, "http_" + fetch.statusCode());
                continue;
            }
            if (!isHtml(fetch.contentType())) {
                failureHandler.onFailure(url, "non_html_content: " + fetch.contentType());
                continue;
            }

            String loadedUrl = fetch.finalUrlOrRequested();
            String html = fetch.body() == null ? "" : fetch.body();
            Document document = Jsoup.parse(html, loadedUrl);
            RenderedPage page = new RenderedPage(
                url,
                loadedUrl,
                fetch.statusCode(),
                fetch.headers(),
                html,
                document,
                fetch.duration(),
                null
            );
            pageHandler.handle(page, frontier);
        }
        log.info("Render run finished handled={} pending={} maxRequests={}", handled, frontier.queue.size(), options.maxRequests());
    }

    private boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("text/html") || lower.contains("application/xhtml");
    }

    static String requestKey(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private static final class QueueFrontier implements Frontier {
        private final Deque<String> queue = new ArrayDeque<>();
        private final Set<String> requested = new HashSet<>();

        @Override
        public int enqueue(Collection<String> urls) {
            int added = 0;
            for (String url : urls) {
                if (url == null || url.isBlank()) {
                    continue;
                }
                String key = requestKey(url.trim());
                if (requested.add(key)) {
                    queue.add(key);
                    added++;
                }
            }
            return added;
        }
    }
}
