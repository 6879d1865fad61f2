package org.netpreserve.trawler.storage;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.util.Objects;

/**
 * A unit of work: one URL to be handled.
 *
 * @param uniqueKey  normalised URL used to deduplicate items
 * @param url        the URL as it was discovered
 * @param depth      link distance from a seed
 * @param retryCount how many times handling this item has failed so far
 * @param maxRetries per-item retry limit overriding the crawl default, or null
 * @param noRetry    fail on the first error without retrying
 * @param state      lifecycle state
 * @param lastError  message of the most recent failure, or null
 */
public record WorkItem(
        String uniqueKey,
        Url url,
        int depth,
        int retryCount,
        @Nullable Integer maxRetries,
        boolean noRetry,
        State state,
        @Nullable String lastError) {

    public WorkItem {
        Objects.requireNonNull(uniqueKey, "uniqueKey");
        Objects.requireNonNull(url, "url");
        if (state == null) state = State.AVAILABLE;
        if (depth < 0) throw new IllegalArgumentException("depth must not be negative");
    }

    public static WorkItem of(Url url, int depth) {
        return new WorkItem(url.uniqueKey(), url, depth, 0, null, false, State.AVAILABLE, null);
    }

    public static WorkItem of(String url) {
        return of(new Url(url), 0);
    }

    public WorkItem withState(State state) {
        return new WorkItem(uniqueKey, url, depth, retryCount, maxRetries, noRetry, state, lastError);
    }

    public WorkItem withMaxRetries(@Nullable Integer maxRetries) {
        return new WorkItem(uniqueKey, url, depth, retryCount, maxRetries, noRetry, state, lastError);
    }

    public WorkItem withNoRetry(boolean noRetry) {
        return new WorkItem(uniqueKey, url, depth, retryCount, maxRetries, noRetry, state, lastError);
    }

    /**
     * Returns the item back in the {@link State#AVAILABLE} state with its retry count incremented.
     */
    WorkItem reclaimed(@Nullable String error) {
        return new WorkItem(uniqueKey, url, depth, retryCount + 1, maxRetries, noRetry, State.AVAILABLE, error);
    }

    public enum State {
        AVAILABLE,
        IN_FLIGHT,
        HANDLED,
        /**
         * Gave up after exhausting retries. Counts as handled.
         */
        FAILED
    }
}
