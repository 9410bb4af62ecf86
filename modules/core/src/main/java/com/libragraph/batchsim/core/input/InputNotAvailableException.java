package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.config.InvalidParameterException;

/**
 * A value asked for an input object that is configured but not built yet, or not
 * configured at all.
 */
public class InputNotAvailableException extends InvalidParameterException {

    private final String typeName;

    public InputNotAvailableException(String typeName, String paramName) {
        super("No input " + typeName + " available for type = " + paramName);
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
