package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.BatchSimException;

/**
 * Extension numbers requested for extra layers overlap, are not positive, or leave a gap.
 */
public class InvalidExtensionLayoutException extends BatchSimException {

    public InvalidExtensionLayoutException(String message) {
        super(message);
    }
}
