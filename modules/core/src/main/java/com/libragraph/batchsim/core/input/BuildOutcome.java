package com.libragraph.batchsim.core.input;

/**
 * Result of a safe-only build attempt.
 */
public sealed interface BuildOutcome {

    record Built(Object object) implements BuildOutcome {
    }

    record Unsafe(String reason) implements BuildOutcome {
    }

    static BuildOutcome built(Object object) {
        return new Built(object);
    }

    static BuildOutcome unsafe(String reason) {
        return new Unsafe(reason);
    }
}
