package org.netpreserve.trawler.storage;

/**
 * A work source could not read or update its items. Not recoverable by retrying the item.
 */
public class WorkSourceException extends RuntimeException {
    public WorkSourceException(String message) {
        super(message);
    }

    public WorkSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
