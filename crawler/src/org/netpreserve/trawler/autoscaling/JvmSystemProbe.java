package org.netpreserve.trawler.autoscaling;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads CPU and heap usage of the running JVM from the platform MXBeans.
 */
public class JvmSystemProbe implements SystemProbe {
    private final OperatingSystemMXBean osMxBean = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memoryMxBean = ManagementFactory.getMemoryMXBean();

    @Override
    public double cpuLoad() {
        if (osMxBean instanceof com.sun.management.OperatingSystemMXBean sunOsMxBean) {
            double load = sunOsMxBean.getProcessCpuLoad();
            if (load >= 0) return load;
        }
        // system load average normalized by processors
        double systemLoad = osMxBean.getSystemLoadAverage();
        if (systemLoad >= 0) {
            return Math.min(1.0, systemLoad / osMxBean.getAvailableProcessors());
        }
        return -1;
    }

    @Override
    public long usedMemoryBytes() {
        return memoryMxBean.getHeapMemoryUsage().getUsed();
    }

    @Override
    public long maxMemoryBytes() {
        long max = memoryMxBean.getHeapMemoryUsage().getMax();
        return max > 0 ? max : Runtime.getRuntime().maxMemory();
    }
}
