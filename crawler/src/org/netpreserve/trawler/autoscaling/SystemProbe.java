package org.netpreserve.trawler.autoscaling;

/**
 * Source of raw host resource measurements.
 */
public interface SystemProbe {
    /**
     * CPU load of this process between 0 and 1, or a negative value if it is not available.
     */
    double cpuLoad();

    long usedMemoryBytes();

    /**
     * The most memory this process can use.
     */
    long maxMemoryBytes();
}
