package com.libragraph.batchsim.core.config;

/**
 * A resolved config value and whether it stays the same for every output file.
 *
 * @param safe false when the value depends on a per-file quantity (a sequence index,
 *             a random draw, an unsafe input object)
 */
public record ParsedValue<T>(T value, boolean safe) {

    public static <T> ParsedValue<T> safe(T value) {
        return new ParsedValue<>(value, true);
    }

    public static <T> ParsedValue<T> unsafe(T value) {
        return new ParsedValue<>(value, false);
    }
}
