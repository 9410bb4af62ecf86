package com.libragraph.batchsim.core.input;

import java.util.Map;

/**
 * Keyword arguments for constructing one input object.
 *
 * @param safe true if every argument is the same for all output files
 */
public record ConstructionArgs(Map<String, Object> kwargs, boolean safe) {

    public ConstructionArgs {
        kwargs = Map.copyOf(kwargs);
    }
}
