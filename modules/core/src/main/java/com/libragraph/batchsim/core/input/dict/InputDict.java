package com.libragraph.batchsim.core.input.dict;

import java.util.Set;

/**
 * Key/value document read from JSON or YAML. Nested keys are joined with the loader's
 * separator, e.g. {@code noise.sigma}.
 */
public interface InputDict {

    /** Value at {@code key}, or {@code null} if there is none. */
    Object get(String key);

    boolean containsKey(String key);

    Set<String> topLevelKeys();
}
