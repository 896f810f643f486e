package com.storyforge.orchestrator.error;

/** The job queue refused or failed to accept a submission. */
public class DispatchException extends OrchestratorException {

    public DispatchException(String message) {
        super(ErrorCode.TASK_START_FAILED, message);
    }

    public DispatchException(String message, Throwable cause) {
        super(ErrorCode.TASK_START_FAILED, message, cause);
    }
}
