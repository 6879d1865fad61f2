package org.netpreserve.trawler.autoscaling;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Overload verdicts for every resource over one window.
 *
 * @param idle      true when no resource is overloaded
 * @param resources verdict per resource
 */
public record SystemInfo(boolean idle, Map<ResourceKind, ResourceStatus> resources) {
    public SystemInfo {
        resources = Map.copyOf(resources);
    }

    public ResourceStatus resource(ResourceKind kind) {
        return resources.get(kind);
    }

    @Override
    public String toString() {
        return "SystemInfo{idle=" + idle + ", " + resources.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey().name().toLowerCase() + "=" + entry.getValue())
                .collect(Collectors.joining(", ")) + "}";
    }

    /**
     * @param overloaded  whether actualRatio exceeds limitRatio
     * @param limitRatio  the configured overload ratio
     * @param actualRatio share of snapshots in the window that were overloaded
     */
    public record ResourceStatus(boolean overloaded, double limitRatio, double actualRatio) {
        @Override
        public String toString() {
            return String.format("%.3f/%.3f%s", actualRatio, limitRatio, overloaded ? "!" : "");
        }
    }
}
