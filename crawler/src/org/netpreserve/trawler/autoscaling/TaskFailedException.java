package org.netpreserve.trawler.autoscaling;

/**
 * Thrown by {@link AutoscaledPool#run()} when a task or hook failed. The cause is the original error.
 */
public class TaskFailedException extends Exception {
    public TaskFailedException(Throwable cause) {
        super("Pool stopped after a task failed: " + cause, cause);
    }
}
