package com.libragraph.batchsim.formats.api;

/**
 * Wraps checked I/O exceptions from image writers.
 */
public class WriteException extends RuntimeException {

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }

    public WriteException(String message) {
        super(message);
    }
}
