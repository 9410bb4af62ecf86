package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.BatchSimException;

/**
 * No loader is registered under the requested input type name.
 */
public class UnknownInputTypeException extends BatchSimException {

    public UnknownInputTypeException(String typeName) {
        super("Unknown input type: " + typeName);
    }
}
