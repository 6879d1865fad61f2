package org.netpreserve.trawler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Thresholds for turning snapshot history into overload verdicts. A resource is overloaded over a window when
 * the share of its overloaded snapshots exceeds its ratio.
 *
 * @param currentHistory              window used for the current status
 * @param historicalHistory           window used for the historical status, null for all retained history
 * @param maxCpuOverloadedRatio       CPU ratio
 * @param maxMemoryOverloadedRatio    memory ratio
 * @param maxSchedulerOverloadedRatio scheduler latency ratio
 * @param maxClientOverloadedRatio    client error ratio
 */
public record SystemStatusConfig(
        @JsonDeserialize(using = DurationDeserializer.class) Duration currentHistory,
        @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration historicalHistory,
        Double maxCpuOverloadedRatio,
        Double maxMemoryOverloadedRatio,
        Double maxSchedulerOverloadedRatio,
        Double maxClientOverloadedRatio
) {
    @JsonCreator
    public SystemStatusConfig {
        if (currentHistory == null) currentHistory = Duration.ofSeconds(5);
        if (maxCpuOverloadedRatio == null) maxCpuOverloadedRatio = 0.4;
        if (maxMemoryOverloadedRatio == null) maxMemoryOverloadedRatio = 0.2;
        if (maxSchedulerOverloadedRatio == null) maxSchedulerOverloadedRatio = 0.6;
        if (maxClientOverloadedRatio == null) maxClientOverloadedRatio = 0.3;

        Validation.requirePositive("currentHistory", currentHistory);
        if (historicalHistory != null) Validation.requirePositive("historicalHistory", historicalHistory);
        Validation.requireRatio("maxCpuOverloadedRatio", maxCpuOverloadedRatio);
        Validation.requireRatio("maxMemoryOverloadedRatio", maxMemoryOverloadedRatio);
        Validation.requireRatio("maxSchedulerOverloadedRatio", maxSchedulerOverloadedRatio);
        Validation.requireRatio("maxClientOverloadedRatio", maxClientOverloadedRatio);
    }

    public SystemStatusConfig() {
        this(null, null, null, null, null, null);
    }
}
