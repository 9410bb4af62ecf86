package com.libragraph.batchsim.core.config;

import java.util.Map;
import java.util.Optional;

/**
 * Parameters parsed from one config branch by {@link ParamParser}.
 *
 * @param values parsed values keyed by parameter name (only keys present in the config)
 * @param safe   true only if every parsed value was safe
 */
public record Params(Map<String, Object> values, boolean safe) {

    public Params {
        values = Map.copyOf(values);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public <T> T get(String name, Class<T> type) {
        Object value = values.get(name);
        if (value == null) {
            throw new InvalidParameterException("Parameter '" + name + "' was not parsed");
        }
        return type.cast(value);
    }

    public <T> Optional<T> optional(String name, Class<T> type) {
        return Optional.ofNullable(values.get(name)).map(type::cast);
    }

    public <T> T getOrDefault(String name, Class<T> type, T defaultValue) {
        return optional(name, type).orElse(defaultValue);
    }
}
