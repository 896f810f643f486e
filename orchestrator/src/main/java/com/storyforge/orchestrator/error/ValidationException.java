package com.storyforge.orchestrator.error;

/** Malformed input: unknown stage name, unknown node type, bad graph. */
public class ValidationException extends OrchestratorException {

    public ValidationException(String message) {
        super(ErrorCode.DATA_VALIDATION_FAILED, message);
    }

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
