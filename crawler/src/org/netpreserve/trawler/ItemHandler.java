package org.netpreserve.trawler;

/**
 * Does the actual work for one item. Throwing marks the attempt as failed. Throw a
 * {@link NonRetryableException} to fail the item without retrying it.
 */
@FunctionalInterface
public interface ItemHandler {
    void handle(ItemContext context) throws Exception;
}
