package org.netpreserve.trawler.autoscaling;

class FakeSystemProbe implements SystemProbe {
    volatile double cpuLoad = 0.1;
    volatile long usedMemoryBytes = 100;
    volatile long maxMemoryBytes = 1000;
    volatile RuntimeException failure;

    @Override
    public double cpuLoad() {
        if (failure != null) throw failure;
        return cpuLoad;
    }

    @Override
    public long usedMemoryBytes() {
        if (failure != null) throw failure;
        return usedMemoryBytes;
    }

    @Override
    public long maxMemoryBytes() {
        return maxMemoryBytes;
    }
}
