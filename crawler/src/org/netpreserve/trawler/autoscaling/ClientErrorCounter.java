package org.netpreserve.trawler.autoscaling;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running count of errors such as HTTP 429 responses reported by clients of remote services. The snapshotter
 * compares the count between samples to decide whether those services are pushing back.
 */
public class ClientErrorCounter {
    private final AtomicLong count = new AtomicLong();

    public void increment() {
        count.incrementAndGet();
    }

    public long count() {
        return count.get();
    }
}
