package org.netpreserve.trawler.autoscaling;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.config.SystemStatusConfig;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;

/**
 * Turns snapshot history into overload verdicts. A resource is overloaded over a window when the share of its
 * snapshots in that window that were individually overloaded exceeds the configured ratio. A window without
 * snapshots is not overloaded.
 * <p>
 * The current status looks at a short window and vetoes new work during spikes. The historical status looks at a
 * long window so the pool only grows after sustained health.
 */
public class SystemStatus {
    private final Snapshotter snapshotter;
    private final SystemStatusConfig config;

    public SystemStatus(Snapshotter snapshotter, SystemStatusConfig config) {
        this.snapshotter = snapshotter;
        this.config = config;
    }

    public SystemInfo getCurrentStatus() {
        return status(config.currentHistory());
    }

    public SystemInfo getHistoricalStatus() {
        return status(config.historicalHistory());
    }

    public boolean isHealthy(@Nullable Duration window) {
        return status(window).idle();
    }

    public boolean isOverloaded(ResourceKind kind, @Nullable Duration window) {
        return resourceStatus(kind, window).overloaded();
    }

    public SystemInfo status(@Nullable Duration window) {
        var resources = new EnumMap<ResourceKind, SystemInfo.ResourceStatus>(ResourceKind.class);
        boolean idle = true;
        for (var kind : ResourceKind.values()) {
            var status = resourceStatus(kind, window);
            resources.put(kind, status);
            if (status.overloaded()) idle = false;
        }
        return new SystemInfo(idle, resources);
    }

    SystemInfo.ResourceStatus resourceStatus(ResourceKind kind, @Nullable Duration window) {
        List<ResourceSnapshot> sample = snapshotter.history(kind, window);
        double limitRatio = limitRatio(kind);
        if (sample.isEmpty()) {
            return new SystemInfo.ResourceStatus(false, limitRatio, 0);
        }
        long overloaded = sample.stream().filter(ResourceSnapshot::overloaded).count();
        double actualRatio = (double) overloaded / sample.size();
        return new SystemInfo.ResourceStatus(actualRatio > limitRatio, limitRatio,
                Math.round(actualRatio * 1000) / 1000.0);
    }

    private double limitRatio(ResourceKind kind) {
        return switch (kind) {
            case CPU -> config.maxCpuOverloadedRatio();
            case MEMORY -> config.maxMemoryOverloadedRatio();
            case SCHEDULER_LATENCY -> config.maxSchedulerOverloadedRatio();
            case CLIENT_ERRORS -> config.maxClientOverloadedRatio();
        };
    }
}
