package com.libragraph.batchsim.core.task;

import com.libragraph.batchsim.core.BatchSimException;

import java.util.List;

/**
 * One or more tasks of a job failed, or a worker died. Raised after the remaining
 * work has been drained.
 */
public class JobFailedException extends BatchSimException {

    private final List<TaskResult<?>> failures;

    public JobFailedException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public JobFailedException(String message, List<TaskResult<?>> failures, Throwable cause) {
        super(message, cause);
        this.failures = List.copyOf(failures);
    }

    public List<TaskResult<?>> failures() {
        return failures;
    }
}
