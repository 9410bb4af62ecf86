package com.libragraph.batchsim.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the nested {@code Map<String, Object>} configuration tree.
 *
 * <p>Maps are always {@link LinkedHashMap} so key order from the job file survives copying.
 */
public final class ConfigMaps {

    private ConfigMaps() {
    }

    /**
     * Deep-copies maps and lists. Scalars and any other values are shared, they are
     * expected to be immutable (strings, numbers, booleans).
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(String.valueOf(e.getKey()), deepCopy(e.getValue()));
            }
            return (T) copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return (T) copy;
        }
        return value;
    }

    /**
     * Shallow copy of the root with the named branches deep-copied. Branches not named
     * are shared by reference with the source tree.
     */
    public static Map<String, Object> copyBranches(Map<String, Object> root, Collection<String> branches) {
        Objects.requireNonNull(root, "root cannot be null");
        Map<String, Object> copy = new LinkedHashMap<>(root);
        for (String branch : branches) {
            if (root.containsKey(branch)) {
                copy.put(branch, deepCopy(root.get(branch)));
            }
        }
        return copy;
    }

    /**
     * Returns the sub-map stored under {@code key}, or {@code null} if absent.
     *
     * @throws IllegalArgumentException if the value is present but not a map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> subMap(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("config." + key + " is not a map: " + value);
        }
        return (Map<String, Object>) value;
    }

    /**
     * Returns the sub-map under {@code key}, inserting an empty one if absent.
     */
    public static Map<String, Object> subMapOrCreate(Map<String, Object> parent, String key) {
        Map<String, Object> existing = subMap(parent, key);
        if (existing != null) {
            return existing;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        parent.put(key, created);
        return created;
    }

    /**
     * Views a value as a list: lists are returned as-is, anything else becomes a
     * one-element list. A {@code null} value gives an empty list.
     */
    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    /**
     * Casts a list element to a map.
     *
     * @throws IllegalArgumentException if the element is not a map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(what + " is not a map: " + value);
        }
        return (Map<String, Object>) value;
    }
}
