package org.netpreserve.trawler.autoscaling;

/**
 * Resources whose load is sampled to decide how much work the pool may take on.
 */
public enum ResourceKind {
    CPU,
    MEMORY,
    /**
     * Delay between asking the pool's control loop to wake up and it actually running.
     */
    SCHEDULER_LATENCY,
    /**
     * Errors such as rate limiting reported by clients of remote services.
     */
    CLIENT_ERRORS
}
