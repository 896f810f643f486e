package com.storyforge.orchestrator.error;

/**
 * Stable numeric error codes returned to API clients alongside the message.
 *
 * 1xxx project state, 2xxx stage state, 3xxx job dispatch,
 * 4xxx input validation, 5xxx system, 6xxx workflow templates.
 */
public enum ErrorCode {

    PROJECT_NOT_FOUND(1001),
    PROJECT_INVALID_STATUS(1002),
    PROJECT_NOT_RESUMABLE(1003),
    PROJECT_NOT_PAUSABLE(1004),

    STAGE_NOT_FOUND(2001),
    STAGE_MAX_RETRIES_EXCEEDED(2003),
    STAGE_ALREADY_PROCESSING(2004),

    TASK_START_FAILED(3001),

    DATA_VALIDATION_FAILED(4001),
    DATA_MISSING_REQUIRED(4002),

    SYSTEM_ERROR(5000),

    TEMPLATE_NOT_FOUND(6001);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() { return code; }
}
