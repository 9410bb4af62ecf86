package com.libragraph.batchsim.core;

/**
 * Base class of the errors a job run can raise.
 */
public class BatchSimException extends RuntimeException {

    public BatchSimException(String message) {
        super(message);
    }

    public BatchSimException(String message, Throwable cause) {
        super(message, cause);
    }
}
