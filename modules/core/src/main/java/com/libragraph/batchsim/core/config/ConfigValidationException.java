package com.libragraph.batchsim.core.config;

import com.libragraph.batchsim.core.BatchSimException;

/**
 * A config branch holds a key its consumer does not recognize, or a branch has the
 * wrong shape. Always fatal.
 */
public class ConfigValidationException extends BatchSimException {

    public ConfigValidationException(String message) {
        super(message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
