package org.netpreserve.trawler;

/**
 * Thrown by an {@link ItemHandler} when retrying the item cannot succeed.
 */
public class NonRetryableException extends Exception {
    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
