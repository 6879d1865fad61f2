package org.netpreserve.trawler.storage;

/**
 * Persisted counters of a {@link WorkQueue}.
 *
 * @param discovered items ever added
 * @param handled    items handled successfully
 * @param failed     items that gave up after exhausting retries
 * @param retried    times an item was returned to the queue after a failure
 */
public record QueueProgress(long discovered, long handled, long failed, long retried) {
}
