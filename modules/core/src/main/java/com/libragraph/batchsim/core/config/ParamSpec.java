package com.libragraph.batchsim.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declares the parameters a config branch accepts.
 *
 * <ul>
 *   <li>required: must be present</li>
 *   <li>optional: may be present</li>
 *   <li>single groups: exactly one key of each group must be present</li>
 *   <li>ignored: allowed but not parsed (consumed elsewhere)</li>
 * </ul>
 * The {@code type} key is always allowed.
 */
public final class ParamSpec {

    private final Map<String, Class<?>> required;
    private final Map<String, Class<?>> optional;
    private final List<Map<String, Class<?>>> single;
    private final Set<String> ignored;

    private ParamSpec(Builder b) {
        this.required = Collections.unmodifiableMap(new LinkedHashMap<>(b.required));
        this.optional = Collections.unmodifiableMap(new LinkedHashMap<>(b.optional));
        List<Map<String, Class<?>>> groups = new ArrayList<>();
        for (Map<String, Class<?>> g : b.single) {
            groups.add(Collections.unmodifiableMap(new LinkedHashMap<>(g)));
        }
        this.single = Collections.unmodifiableList(groups);
        this.ignored = Collections.unmodifiableSet(new LinkedHashSet<>(b.ignored));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ParamSpec empty() {
        return new Builder().build();
    }

    public Map<String, Class<?>> required() {
        return required;
    }

    public Map<String, Class<?>> optional() {
        return optional;
    }

    public List<Map<String, Class<?>>> single() {
        return single;
    }

    public Set<String> ignored() {
        return ignored;
    }

    /** Every key this spec allows, {@code type} included. */
    public Set<String> validKeys() {
        Set<String> keys = new LinkedHashSet<>();
        keys.add("type");
        keys.addAll(required.keySet());
        keys.addAll(optional.keySet());
        for (Map<String, Class<?>> g : single) {
            keys.addAll(g.keySet());
        }
        keys.addAll(ignored);
        return keys;
    }

    public static final class Builder {
        private final Map<String, Class<?>> required = new LinkedHashMap<>();
        private final Map<String, Class<?>> optional = new LinkedHashMap<>();
        private final List<Map<String, Class<?>>> single = new ArrayList<>();
        private final Set<String> ignored = new LinkedHashSet<>();

        public Builder required(String name, Class<?> type) {
            required.put(name, type);
            return this;
        }

        public Builder optional(String name, Class<?> type) {
            optional.put(name, type);
            return this;
        }

        public Builder single(Map<String, Class<?>> group) {
            single.add(new LinkedHashMap<>(group));
            return this;
        }

        public Builder ignore(String... names) {
            Collections.addAll(ignored, names);
            return this;
        }

        public Builder ignore(Iterable<String> names) {
            for (String n : names) ignored.add(n);
            return this;
        }

        public ParamSpec build() {
            return new ParamSpec(this);
        }
    }
}
