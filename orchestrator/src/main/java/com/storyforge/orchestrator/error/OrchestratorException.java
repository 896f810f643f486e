package com.storyforge.orchestrator.error;

/**
 * Base class for every failure the orchestrator reports to a caller.
 *
 * Unchecked so service methods stay free of throws clauses; the API layer
 * maps each subclass to an HTTP status in {@code ApiExceptionHandler}.
 */
public abstract class OrchestratorException extends RuntimeException {

    private final ErrorCode code;

    protected OrchestratorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected OrchestratorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }
}
