package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParsedValue;

import java.util.Map;
import java.util.Set;

/**
 * Resolves config entries into typed values. Entries are either literals or value
 * configs (a map with a {@code type} key naming a generator).
 */
public interface ValueEvaluator {

    <T> ParsedValue<T> parse(Map<String, Object> parent, String key, JobContext ctx, Class<T> type);

    /**
     * Forgets memoized values whose generator is one of {@code valueTypes}. Called when
     * an input object they read from is rebuilt.
     *
     * @return number of memo entries dropped
     */
    int removeCurrent(JobContext ctx, Set<String> valueTypes);
}
