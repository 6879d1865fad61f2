package org.netpreserve.trawler.autoscaling;

/**
 * Outcome of one task run by the pool. Only a {@link FatalFailure} stops the pool. Work that can be retried
 * should be reported as a {@link RetryableFailure} after it has been rescheduled.
 */
public sealed interface TaskResult permits TaskResult.Ok, TaskResult.RetryableFailure, TaskResult.FatalFailure {
    TaskResult OK = new Ok();

    static TaskResult ok() {
        return OK;
    }

    static TaskResult retryable(Throwable cause) {
        return new RetryableFailure(cause);
    }

    static TaskResult fatal(Throwable cause) {
        return new FatalFailure(cause);
    }

    record Ok() implements TaskResult {
    }

    record RetryableFailure(Throwable cause) implements TaskResult {
    }

    record FatalFailure(Throwable cause) implements TaskResult {
    }
}
