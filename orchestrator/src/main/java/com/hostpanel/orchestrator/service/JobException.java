package com.hostpanel.orchestrator.service;

/**
 * Failure raised by the orchestrator, its pipelines, or the transfer layer.
 *
 * The {@link Kind} decides how the failure propagates: INVALID_INPUT,
 * NOT_FOUND and ALREADY_TERMINAL are returned to the caller, SOURCE_UNREACHABLE
 * aborts a whole job, and TARGET_FAILURE / CONVERSION_TOOL_FAILURE are recorded
 * on a single target while its siblings carry on.
 *
 * Unchecked so that pipeline code only catches it where it has a recovery.
 */
public class JobException extends RuntimeException {

    public enum Kind {
        INVALID_INPUT,
        SOURCE_UNREACHABLE,
        TARGET_FAILURE,
        CONVERSION_TOOL_FAILURE,
        NOT_FOUND,
        ALREADY_TERMINAL
    }

    private final Kind kind;

    public JobException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public JobException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static JobException invalidInput(String message) {
        return new JobException(Kind.INVALID_INPUT, message);
    }

    public static JobException notFound(String what, Object id) {
        return new JobException(Kind.NOT_FOUND, what + " not found: " + id);
    }
}
