package com.libragraph.batchsim.core.config;

import com.libragraph.batchsim.core.BatchSimException;

/**
 * A parameter is missing, malformed, or violates its required/optional/single group.
 */
public class InvalidParameterException extends BatchSimException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
