package org.netpreserve.trawler.autoscaling;

/**
 * Current and desired concurrency of a pool and the bounds desired concurrency moves between.
 * <p>
 * Mutated only by the pool's control loop. Fields are volatile so other threads can read them.
 */
class ConcurrencyState {
    private volatile int min;
    private volatile int max;
    private volatile int desired;
    private volatile int current;

    ConcurrencyState(int min, int max, int desired) {
        if (min < 1 || max < min) throw new IllegalArgumentException("Invalid bounds " + min + ".." + max);
        this.min = min;
        this.max = max;
        this.desired = Math.max(min, Math.min(max, desired));
    }

    int min() {
        return min;
    }

    int max() {
        return max;
    }

    int desired() {
        return desired;
    }

    int current() {
        return current;
    }

    boolean hasCapacity() {
        return current < desired;
    }

    void acquire() {
        if (current >= desired) {
            throw new IllegalStateException("No capacity: current " + current + ", desired " + desired);
        }
        current++;
    }

    void release() {
        if (current <= 0) throw new IllegalStateException("Released more tasks than were acquired");
        current--;
    }

    /**
     * Whether current concurrency has reached the given share of desired concurrency.
     */
    boolean isSaturated(double ratio) {
        return current >= desired * ratio;
    }

    /**
     * Grows desired concurrency by the given share of itself, at least by one and never past max.
     *
     * @return the new desired concurrency
     */
    int scaleUp(double stepRatio) {
        desired = Math.min(max, desired + step(stepRatio));
        return desired;
    }

    /**
     * Shrinks desired concurrency by the given share of itself, at least by one and never below min.
     *
     * @return the new desired concurrency
     */
    int scaleDown(double stepRatio) {
        desired = Math.max(min, desired - step(stepRatio));
        return desired;
    }

    private int step(double stepRatio) {
        return Math.max(1, (int) Math.ceil(desired * stepRatio));
    }

    void updateBounds(int min, int max) {
        if (min < 1 || max < min) throw new IllegalArgumentException("Invalid bounds " + min + ".." + max);
        this.min = min;
        this.max = max;
        this.desired = Math.max(min, Math.min(max, desired));
    }

    @Override
    public String toString() {
        return "current=" + current + ", desired=" + desired + ", min=" + min + ", max=" + max;
    }
}
