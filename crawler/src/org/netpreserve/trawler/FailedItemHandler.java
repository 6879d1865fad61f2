package org.netpreserve.trawler;

/**
 * Called once for an item that failed permanently. Throwing stops the crawl.
 */
@FunctionalInterface
public interface FailedItemHandler {
    void handleFailed(ItemContext context, Throwable error) throws Exception;
}
