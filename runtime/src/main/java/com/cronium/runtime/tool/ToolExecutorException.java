package com.cronium.runtime.tool;

/**
 * Thrown when the tool-execution subsystem cannot give a definite answer.
 *
 * The kind tells the forwarder how to report it: a TIMEOUT means the action
 * may or may not have run, UNAVAILABLE means it was never accepted, REJECTED
 * means the subsystem refused the request as invalid.
 */
public class ToolExecutorException extends RuntimeException {

    public enum Kind { TIMEOUT, UNAVAILABLE, REJECTED }

    private final Kind kind;

    public ToolExecutorException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ToolExecutorException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
