package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.BatchSimException;

/**
 * A loader failed to build its input object (missing file, unreadable data...).
 */
public class InputConstructionException extends BatchSimException {

    public InputConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
