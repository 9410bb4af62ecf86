package com.libragraph.batchsim.core.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a config branch against a {@link ParamSpec} and parses its values.
 */
public final class ParamParser {

    private ParamParser() {
    }

    /**
     * Checks the branch shape, then parses every present parameter through the context's
     * value evaluator.
     *
     * @throws ConfigValidationException if the branch holds an unrecognized key
     * @throws InvalidParameterException if a required key is missing or a single group
     *                                   does not have exactly one key
     */
    public static Params getAllParams(Map<String, Object> config, String where,
                                      JobContext ctx, ParamSpec spec) {
        checkAllParams(config, where, spec);

        Map<String, Object> values = new LinkedHashMap<>();
        boolean safe = true;

        for (Map.Entry<String, Class<?>> e : spec.required().entrySet()) {
            ParsedValue<?> v = ctx.parse(config, e.getKey(), e.getValue());
            values.put(e.getKey(), v.value());
            safe &= v.safe();
        }
        for (Map.Entry<String, Class<?>> e : spec.optional().entrySet()) {
            if (config.containsKey(e.getKey())) {
                ParsedValue<?> v = ctx.parse(config, e.getKey(), e.getValue());
                values.put(e.getKey(), v.value());
                safe &= v.safe();
            }
        }
        for (Map<String, Class<?>> group : spec.single()) {
            for (Map.Entry<String, Class<?>> e : group.entrySet()) {
                if (config.containsKey(e.getKey())) {
                    ParsedValue<?> v = ctx.parse(config, e.getKey(), e.getValue());
                    values.put(e.getKey(), v.value());
                    safe &= v.safe();
                }
            }
        }
        return new Params(values, safe);
    }

    /**
     * Checks required keys, single groups and unknown keys without parsing anything.
     */
    public static void checkAllParams(Map<String, Object> config, String where, ParamSpec spec) {
        for (String name : spec.required().keySet()) {
            if (!config.containsKey(name)) {
                throw new InvalidParameterException(
                        "Attribute " + name + " is required for " + where);
            }
        }
        for (Map<String, Class<?>> group : spec.single()) {
            List<String> present = new ArrayList<>();
            for (String name : group.keySet()) {
                if (config.containsKey(name)) present.add(name);
            }
            if (present.size() != 1) {
                throw new InvalidParameterException("Exactly one of " + group.keySet()
                        + " is required for " + where + ", found " + present);
            }
        }
        checkAllowedKeys(config, where, spec.validKeys());
    }

    /**
     * @throws ConfigValidationException naming the first key not in {@code valid}
     */
    public static void checkAllowedKeys(Map<String, Object> config, String where,
                                        Collection<String> valid) {
        for (String key : config.keySet()) {
            if (!valid.contains(key)) {
                throw new ConfigValidationException(
                        "Unexpected attribute " + key + " found for " + where
                                + " (valid keys: " + valid + ")");
            }
        }
    }
}
