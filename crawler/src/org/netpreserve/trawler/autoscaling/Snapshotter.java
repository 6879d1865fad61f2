package org.netpreserve.trawler.autoscaling;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.config.SnapshotterConfig;
import org.netpreserve.trawler.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically samples CPU, memory, scheduler latency and client errors and keeps a bounded history of each.
 * <p>
 * Every resource kind is sampled on its own timer so a slow sample of one does not delay the others. A sample that
 * fails is logged and recorded as overloaded rather than dropped.
 */
public class Snapshotter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Snapshotter.class);
    private static final double RESERVE_MEMORY_RATIO = 0.5;
    private static final Duration CRITICAL_OVERLOAD_LOG_INTERVAL = Duration.ofSeconds(10);

    private final SnapshotterConfig config;
    private final SystemProbe probe;
    private final ClientErrorCounter clientErrors;
    private final Clock clock;
    private final Map<ResourceKind, SnapshotHistory> histories = new EnumMap<>(ResourceKind.class);
    private final AtomicReference<PendingProbe> pendingSchedulerProbe = new AtomicReference<>();
    private ScheduledExecutorService scheduler;
    private volatile Executor controlLoop;
    private volatile long memoryLimitBytes;
    private Instant lastCriticalMemoryWarning;
    private Long lastClientErrorCount;

    public Snapshotter(SnapshotterConfig config) {
        this(config, new JvmSystemProbe(), new ClientErrorCounter(), Clock.systemUTC());
    }

    public Snapshotter(SnapshotterConfig config, SystemProbe probe, ClientErrorCounter clientErrors, Clock clock) {
        this.config = config;
        this.probe = probe;
        this.clientErrors = clientErrors;
        this.clock = clock;
        for (var kind : ResourceKind.values()) {
            histories.put(kind, new SnapshotHistory(config.history()));
        }
    }

    /**
     * Starts sampling. Scheduler latency is measured as the delay before a no-op submitted to
     * {@code controlLoop} runs. Calling this on a started snapshotter does nothing.
     */
    public synchronized void start(Executor controlLoop) {
        if (scheduler != null) return;
        this.controlLoop = controlLoop;
        this.memoryLimitBytes = config.maxMemoryBytes() != null ? config.maxMemoryBytes()
                : (long) Math.ceil(probe.maxMemoryBytes() * config.availableMemoryRatio());
        log.debug("Memory limit set to {} MB", memoryLimitBytes / 1024 / 1024);

        scheduler = Executors.newScheduledThreadPool(ResourceKind.values().length,
                new NamedThreadFactory("snapshotter"));
        schedule(ResourceKind.CPU, config.cpuInterval());
        schedule(ResourceKind.MEMORY, config.memoryInterval());
        schedule(ResourceKind.SCHEDULER_LATENCY, config.schedulerInterval());
        schedule(ResourceKind.CLIENT_ERRORS, config.clientInterval());
    }

    private void schedule(ResourceKind kind, Duration interval) {
        scheduler.scheduleWithFixedDelay(() -> sample(kind), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
        pendingSchedulerProbe.set(null);
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public ClientErrorCounter clientErrors() {
        return clientErrors;
    }

    /**
     * Returns the retained snapshots of a resource captured within {@code window} of now, oldest first. A null
     * window returns the whole retained history.
     */
    public List<ResourceSnapshot> history(ResourceKind kind, @Nullable Duration window) {
        Instant cutoff = window == null ? null : clock.instant().minus(window);
        return histories.get(kind).since(cutoff);
    }

    void sample(ResourceKind kind) {
        Instant now = clock.instant();
        ResourceSnapshot snapshot;
        try {
            snapshot = switch (kind) {
                case CPU -> sampleCpu(now);
                case MEMORY -> sampleMemory(now);
                case SCHEDULER_LATENCY -> sampleSchedulerLatency(now);
                case CLIENT_ERRORS -> sampleClientErrors(now);
            };
        } catch (Exception e) {
            log.atWarn().addKeyValue("resource", kind).setCause(e)
                    .log("Sampling failed, recording resource as overloaded");
            snapshot = new ResourceSnapshot(kind, now, true, Double.NaN);
        }
        if (snapshot != null) record(snapshot);
    }

    void record(ResourceSnapshot snapshot) {
        histories.get(snapshot.kind()).add(snapshot);
    }

    private @Nullable ResourceSnapshot sampleCpu(Instant now) {
        double load = probe.cpuLoad();
        if (load < 0) {
            log.trace("CPU load not available");
            return null;
        }
        return new ResourceSnapshot(ResourceKind.CPU, now, load > config.maxUsedCpuRatio(), load);
    }

    private ResourceSnapshot sampleMemory(Instant now) {
        long usedBytes = probe.usedMemoryBytes();
        long limitBytes = memoryLimitBytes > 0 ? memoryLimitBytes : probe.maxMemoryBytes();
        double ratio = (double) usedBytes / limitBytes;
        warnIfMemoryCriticallyOverloaded(now, usedBytes, limitBytes);
        return new ResourceSnapshot(ResourceKind.MEMORY, now, ratio > config.maxUsedMemoryRatio(), ratio);
    }

    private void warnIfMemoryCriticallyOverloaded(Instant now, long usedBytes, long limitBytes) {
        if (lastCriticalMemoryWarning != null &&
            now.isBefore(lastCriticalMemoryWarning.plus(CRITICAL_OVERLOAD_LOG_INTERVAL))) return;
        double maxDesiredBytes = config.maxUsedMemoryRatio() * limitBytes;
        double reserveBytes = limitBytes * (1 - config.maxUsedMemoryRatio()) * RESERVE_MEMORY_RATIO;
        if (usedBytes > maxDesiredBytes + reserveBytes) {
            log.warn("Memory is critically overloaded. Using {} MB of {} MB ({}%). Consider increasing available memory.",
                    usedBytes / 1024 / 1024, limitBytes / 1024 / 1024, Math.round(100.0 * usedBytes / limitBytes));
            lastCriticalMemoryWarning = now;
        }
    }

    /**
     * Submits a probe to the control loop. The snapshot is recorded by the probe itself when it runs, unless the
     * previous probe is still waiting, in which case the wait so far is recorded.
     */
    private @Nullable ResourceSnapshot sampleSchedulerLatency(Instant now) {
        Executor executor = controlLoop;
        if (executor == null) return null;
        long maxBlockedNanos = config.maxBlocked().toNanos();

        PendingProbe pending = pendingSchedulerProbe.get();
        if (pending != null) {
            long waitedNanos = System.nanoTime() - pending.submittedNanos;
            if (waitedNanos <= maxBlockedNanos) return null;
            return new ResourceSnapshot(ResourceKind.SCHEDULER_LATENCY, now, true, waitedNanos / 1_000_000.0);
        }

        var wakeup = new PendingProbe(System.nanoTime());
        pendingSchedulerProbe.set(wakeup);
        executor.execute(() -> {
            long delayNanos = System.nanoTime() - wakeup.submittedNanos;
            if (pendingSchedulerProbe.compareAndSet(wakeup, null)) {
                record(new ResourceSnapshot(ResourceKind.SCHEDULER_LATENCY, clock.instant(),
                        delayNanos > maxBlockedNanos, delayNanos / 1_000_000.0));
            }
        });
        return null;
    }

    private ResourceSnapshot sampleClientErrors(Instant now) {
        long count = clientErrors.count();
        long delta = lastClientErrorCount == null ? 0 : count - lastClientErrorCount;
        lastClientErrorCount = count;
        return new ResourceSnapshot(ResourceKind.CLIENT_ERRORS, now, delta > config.maxClientErrors(), delta);
    }

    private record PendingProbe(long submittedNanos) {
    }
}
