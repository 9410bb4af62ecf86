package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParsedValue;

import java.util.Map;

/**
 * Produces a raw value from a value config such as {@code {type: Sequence, first: 1}}.
 * The evaluator coerces the result to the requested type.
 */
@FunctionalInterface
public interface ValueGenerator {

    ParsedValue<?> generate(Map<String, Object> config, JobContext ctx, Class<?> type);
}
