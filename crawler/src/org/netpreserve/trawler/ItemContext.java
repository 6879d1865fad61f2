package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.autoscaling.ClientErrorCounter;
import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.storage.WorkItem;
import org.netpreserve.trawler.storage.WorkQueue;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * What a handler gets to work with for one item.
 */
public class ItemContext {
    private static final Logger log = LoggerFactory.getLogger(ItemContext.class);
    private final WorkItem item;
    private final CrawlConfig config;
    private final @Nullable WorkQueue queue;
    private final ClientErrorCounter clientErrors;
    private volatile boolean skipRetries;

    ItemContext(WorkItem item, CrawlConfig config, @Nullable WorkQueue queue, ClientErrorCounter clientErrors) {
        this.item = item;
        this.config = config;
        this.queue = queue;
        this.clientErrors = clientErrors;
    }

    public WorkItem item() {
        return item;
    }

    public Url url() {
        return item.url();
    }

    /**
     * Enqueues URLs discovered while handling this item one level deeper than it. URLs beyond the configured
     * maximum depth are dropped.
     *
     * @return how many of the URLs were new
     * @throws IllegalStateException if the crawl has no work queue
     */
    public int addItems(Collection<Url> urls) {
        if (queue == null) throw new IllegalStateException("Crawl has no work queue to add items to");
        int depth = item.depth() + 1;
        Integer maxDepth = config.maxDepth();
        if (maxDepth != null && depth > maxDepth) {
            log.atDebug().addKeyValue("url", item.url()).addKeyValue("links", urls.size())
                    .log("Not adding links beyond max depth");
            return 0;
        }
        return queue.addUrls(urls, depth);
    }

    /**
     * Records a sign that the remote side is overloaded, such as an HTTP 429 response.
     */
    public void reportClientError() {
        clientErrors.increment();
    }

    /**
     * Fails the item without using its remaining retries. Only has an effect from an {@link ItemErrorHandler}.
     */
    public void skipRetries() {
        skipRetries = true;
    }

    boolean retriesSkipped() {
        return skipRetries;
    }
}
