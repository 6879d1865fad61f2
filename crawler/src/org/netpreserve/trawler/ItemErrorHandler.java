package org.netpreserve.trawler;

/**
 * Called after a failed attempt that is about to be retried, before the item goes back to the work source. It can
 * inspect the error and call {@link ItemContext#skipRetries()} to give up on the item straight away. Throwing stops
 * the crawl.
 */
@FunctionalInterface
public interface ItemErrorHandler {
    void handleError(ItemContext context, Throwable error) throws Exception;
}
