package org.netpreserve.trawler.autoscaling;

public enum PoolState {
    IDLE,
    RUNNING,
    /**
     * Paused but tasks started before the pause are still running.
     */
    PAUSING,
    PAUSED,
    FINISHED,
    ABORTED,
    ERRORED;

    public boolean isTerminal() {
        return this == FINISHED || this == ABORTED || this == ERRORED;
    }
}
