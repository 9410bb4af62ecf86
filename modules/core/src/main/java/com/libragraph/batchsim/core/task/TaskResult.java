package com.libragraph.batchsim.core.task;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one task run by a {@link WorkerPool}.
 *
 * @param index  position of the task in the submitted list
 * @param worker name of the thread that ran it
 * @param value  the task's result, {@code null} when failed
 * @param error  set when failed
 */
public record TaskResult<R>(
        int index,
        String worker,
        TaskStatus status,
        R value,
        TaskError error,
        Duration elapsed
) {
    public static <R> TaskResult<R> done(int index, String worker, R value, Duration elapsed) {
        return new TaskResult<>(index, worker, TaskStatus.DONE, value, null, elapsed);
    }

    public static <R> TaskResult<R> failed(int index, String worker, TaskError error, Duration elapsed) {
        return new TaskResult<>(index, worker, TaskStatus.FAILED, null, error, elapsed);
    }

    public boolean isDone() {
        return status == TaskStatus.DONE;
    }

    public Optional<TaskError> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
