package com.libragraph.batchsim.core.input;

/**
 * Which configured inputs a {@link InputObjectCache#processInputs} pass touches.
 */
public enum ProcessScope {
    /** Every configured input. */
    ALL,
    /** Only inputs that must exist before per-file setup. */
    FILE_SCOPE_ONLY,
    /** Every input, but only built when it is safe for all files; the rest stay unbuilt. */
    SAFE_ONLY,
    /** Only inputs that can report an object count. */
    COUNT_CAPABLE_ONLY
}
