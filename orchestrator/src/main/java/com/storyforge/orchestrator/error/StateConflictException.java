package com.storyforge.orchestrator.error;

/**
 * The requested operation is not allowed from the current project or stage
 * status (pause while not processing, retry past max_retries, ...).
 */
public class StateConflictException extends OrchestratorException {

    public StateConflictException(ErrorCode code, String message) {
        super(code, message);
    }
}
