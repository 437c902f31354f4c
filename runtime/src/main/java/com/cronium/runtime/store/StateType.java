package com.cronium.runtime.store;

/**
 * Namespaces of per-execution state. Each maps to the first segment of a {@link StateKey}.
 */
public enum StateType {
    INPUT,
    OUTPUT,
    VARIABLE,
    CONDITION,
    CONTEXT,
    // Rate-limit counters, one per (caller, window).
    RATE;

    /** Lowercase prefix used in the canonical key string, e.g. "variable". */
    public String prefix() {
        return name().toLowerCase();
    }
}
