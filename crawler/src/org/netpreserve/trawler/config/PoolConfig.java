package org.netpreserve.trawler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for the autoscaled task pool.
 *
 * @param minConcurrency          lower bound for desired concurrency
 * @param maxConcurrency          upper bound for desired concurrency
 * @param desiredConcurrency      starting desired concurrency, defaults to minConcurrency
 * @param desiredConcurrencyRatio how saturated the pool must be before it may scale up
 * @param scaleUpStepRatio        share of desired concurrency added when scaling up
 * @param scaleDownStepRatio      share of desired concurrency removed when scaling down
 * @param maybeRunInterval        how often admission is retried without a task settling
 * @param autoscaleInterval       how often desired concurrency is recomputed
 * @param loggingInterval         how often pool state is logged, null to disable
 * @param taskTimeout             longest a single task may run before failing the pool, null for no limit
 * @param maxTasksPerMinute       rate limit on task starts, null for no limit
 * @param snapshotter             resource sampling
 * @param systemStatus            overload thresholds
 */
public record PoolConfig(
        Integer minConcurrency,
        Integer maxConcurrency,
        @Nullable Integer desiredConcurrency,
        Double desiredConcurrencyRatio,
        Double scaleUpStepRatio,
        Double scaleDownStepRatio,
        @JsonDeserialize(using = DurationDeserializer.class) Duration maybeRunInterval,
        @JsonDeserialize(using = DurationDeserializer.class) Duration autoscaleInterval,
        @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration loggingInterval,
        @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration taskTimeout,
        @Nullable Integer maxTasksPerMinute,
        SnapshotterConfig snapshotter,
        SystemStatusConfig systemStatus
) {
    @JsonCreator
    public PoolConfig {
        if (minConcurrency == null) minConcurrency = 1;
        if (maxConcurrency == null) maxConcurrency = 200;
        if (desiredConcurrencyRatio == null) desiredConcurrencyRatio = 0.95;
        if (scaleUpStepRatio == null) scaleUpStepRatio = 0.05;
        if (scaleDownStepRatio == null) scaleDownStepRatio = 0.05;
        if (maybeRunInterval == null) maybeRunInterval = Duration.ofMillis(500);
        if (autoscaleInterval == null) autoscaleInterval = Duration.ofSeconds(10);
        if (snapshotter == null) snapshotter = new SnapshotterConfig();
        if (systemStatus == null) systemStatus = new SystemStatusConfig();

        if (minConcurrency < 1) throw new IllegalArgumentException("minConcurrency must be at least 1");
        if (maxConcurrency < minConcurrency) {
            throw new IllegalArgumentException("maxConcurrency (" + maxConcurrency + ") must not be less than " +
                                               "minConcurrency (" + minConcurrency + ")");
        }
        if (desiredConcurrency != null) {
            desiredConcurrency = Math.max(minConcurrency, Math.min(maxConcurrency, desiredConcurrency));
        }
        Validation.requireRatio("desiredConcurrencyRatio", desiredConcurrencyRatio);
        Validation.requireStepRatio("scaleUpStepRatio", scaleUpStepRatio);
        Validation.requireStepRatio("scaleDownStepRatio", scaleDownStepRatio);
        Validation.requirePositive("maybeRunInterval", maybeRunInterval);
        Validation.requirePositive("autoscaleInterval", autoscaleInterval);
        if (loggingInterval != null) Validation.requirePositive("loggingInterval", loggingInterval);
        if (taskTimeout != null) Validation.requirePositive("taskTimeout", taskTimeout);
        if (maxTasksPerMinute != null && maxTasksPerMinute < 1) {
            throw new IllegalArgumentException("maxTasksPerMinute must be at least 1");
        }
    }

    public PoolConfig() {
        this(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public int initialDesiredConcurrency() {
        return desiredConcurrency == null ? minConcurrency : desiredConcurrency;
    }

    public PoolConfig withConcurrency(int minConcurrency, int maxConcurrency) {
        return new PoolConfig(minConcurrency, maxConcurrency, desiredConcurrency, desiredConcurrencyRatio,
                scaleUpStepRatio, scaleDownStepRatio, maybeRunInterval, autoscaleInterval, loggingInterval,
                taskTimeout, maxTasksPerMinute, snapshotter, systemStatus);
    }
}
