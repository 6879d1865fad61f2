package org.netpreserve.trawler.autoscaling;

/**
 * Supplies work to an {@link AutoscaledPool}.
 * <p>
 * {@link #isTaskReady()} and {@link #isFinished()} are called from the pool's control loop and should return
 * quickly. {@link #runTask()} is called on a worker thread.
 */
public interface TaskProvider {
    /**
     * Runs one task. Throwing is treated the same as returning a {@link TaskResult.FatalFailure}.
     */
    TaskResult runTask() throws Exception;

    /**
     * Whether a task could be started now.
     */
    boolean isTaskReady() throws Exception;

    /**
     * Whether all work is done. Only called when no task is running and {@link #isTaskReady()} returned false.
     */
    boolean isFinished() throws Exception;
}
