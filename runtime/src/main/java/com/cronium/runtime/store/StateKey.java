package com.cronium.runtime.store;

/**
 * Address of one entry in the execution state store: {@code (type, executionId, key)}.
 *
 * The execution id is always part of the key, so two executions can never
 * collide even when they pick the same variable name. Singleton entries
 * (input, output, condition, context) use an empty key.
 *
 * Canonical string form: {@code variable:exec-1:counter}, {@code input:exec-1}.
 */
public record StateKey(StateType type, String executionId, String key) {

    public StateKey {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId is required");
        }
        if (key == null) key = "";
    }

    public static StateKey input(String executionId)     { return new StateKey(StateType.INPUT, executionId, ""); }
    public static StateKey output(String executionId)    { return new StateKey(StateType.OUTPUT, executionId, ""); }
    public static StateKey condition(String executionId) { return new StateKey(StateType.CONDITION, executionId, ""); }
    public static StateKey context(String executionId)   { return new StateKey(StateType.CONTEXT, executionId, ""); }

    public static StateKey variable(String executionId, String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("variable name is required");
        }
        return new StateKey(StateType.VARIABLE, executionId, name);
    }

    /** Counter for one fixed rate-limit window of one caller. */
    public static StateKey rateWindow(String callerKey, long windowIndex) {
        return new StateKey(StateType.RATE, callerKey, Long.toString(windowIndex));
    }

    @Override
    public String toString() {
        return key.isEmpty()
                ? type.prefix() + ":" + executionId
                : type.prefix() + ":" + executionId + ":" + key;
    }
}
