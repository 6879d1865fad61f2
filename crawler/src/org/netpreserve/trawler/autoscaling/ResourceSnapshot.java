package org.netpreserve.trawler.autoscaling;

import java.time.Instant;

/**
 * One sample of a resource.
 *
 * @param kind       the resource sampled
 * @param capturedAt when the sample was taken
 * @param overloaded whether this sample on its own exceeded the resource's limit
 * @param value      the measured value (a ratio, milliseconds of delay or an error count depending on kind)
 */
public record ResourceSnapshot(ResourceKind kind, Instant capturedAt, boolean overloaded, double value) {
    ResourceSnapshot withCapturedAt(Instant capturedAt) {
        return new ResourceSnapshot(kind, capturedAt, overloaded, value);
    }
}
