package com.storyforge.orchestrator.dispatch;

/**
 * State of a dispatched job as the queue sees it.
 *
 * RETRYING means the job failed transiently and a follow-up job was
 * submitted; the follow-up has its own handle.
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("started"),
    SUCCESS("success"),
    FAILURE("failure"),
    RETRYING("retry");

    private final String apiState;

    JobStatus(String apiState) {
        this.apiState = apiState;
    }

    /** Name reported by the task-status endpoint. */
    public String apiState() { return apiState; }

    public boolean isFinished() {
        return this == SUCCESS || this == FAILURE || this == RETRYING;
    }
}
