package org.netpreserve.trawler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.DurationDeserializer;

import java.time.Duration;

/**
 * How often each resource is sampled and what counts as an overloaded sample.
 *
 * @param cpuInterval          time between CPU samples
 * @param memoryInterval       time between memory samples
 * @param schedulerInterval    time between scheduler latency probes
 * @param clientInterval       time between client error samples
 * @param history              how long samples are retained
 * @param maxUsedCpuRatio      process CPU load above which a sample is overloaded
 * @param maxUsedMemoryRatio   share of the memory limit above which a sample is overloaded
 * @param maxMemoryBytes       explicit memory limit, overrides availableMemoryRatio
 * @param availableMemoryRatio share of the JVM max heap used as the memory limit
 * @param maxBlocked           scheduler wake-up delay above which a sample is overloaded
 * @param maxClientErrors      client errors per sampling interval above which a sample is overloaded
 */
public record SnapshotterConfig(
        @JsonDeserialize(using = DurationDeserializer.class) Duration cpuInterval,
        @JsonDeserialize(using = DurationDeserializer.class) Duration memoryInterval,
        @JsonDeserialize(using = DurationDeserializer.class) Duration schedulerInterval,
        @JsonDeserialize(using = DurationDeserializer.class) Duration clientInterval,
        @JsonDeserialize(using = DurationDeserializer.class) Duration history,
        Double maxUsedCpuRatio,
        Double maxUsedMemoryRatio,
        @Nullable Long maxMemoryBytes,
        Double availableMemoryRatio,
        @JsonDeserialize(using = DurationDeserializer.class) Duration maxBlocked,
        Integer maxClientErrors
) {
    @JsonCreator
    public SnapshotterConfig {
        if (cpuInterval == null) cpuInterval = Duration.ofSeconds(1);
        if (memoryInterval == null) memoryInterval = Duration.ofSeconds(1);
        if (schedulerInterval == null) schedulerInterval = Duration.ofMillis(500);
        if (clientInterval == null) clientInterval = Duration.ofSeconds(1);
        if (history == null) history = Duration.ofSeconds(30);
        if (maxUsedCpuRatio == null) maxUsedCpuRatio = 0.95;
        if (maxUsedMemoryRatio == null) maxUsedMemoryRatio = 0.7;
        if (availableMemoryRatio == null) availableMemoryRatio = 1.0;
        if (maxBlocked == null) maxBlocked = Duration.ofMillis(50);
        if (maxClientErrors == null) maxClientErrors = 3;

        Validation.requirePositive("cpuInterval", cpuInterval);
        Validation.requirePositive("memoryInterval", memoryInterval);
        Validation.requirePositive("schedulerInterval", schedulerInterval);
        Validation.requirePositive("clientInterval", clientInterval);
        Validation.requirePositive("history", history);
        Validation.requireRatio("maxUsedCpuRatio", maxUsedCpuRatio);
        Validation.requireRatio("maxUsedMemoryRatio", maxUsedMemoryRatio);
        Validation.requireRatio("availableMemoryRatio", availableMemoryRatio);
        if (maxMemoryBytes != null && maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxMemoryBytes must be positive");
        }
        if (maxClientErrors < 0) throw new IllegalArgumentException("maxClientErrors must not be negative");
    }

    public SnapshotterConfig() {
        this(null, null, null, null, null, null, null, null, null, null, null);
    }
}
