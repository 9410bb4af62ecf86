package com.libragraph.batchsim.core.share;

import com.libragraph.batchsim.core.BatchSimException;

/**
 * The shared input manager could not start its owner thread.
 */
public class ManagerStartupException extends BatchSimException {

    public ManagerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
