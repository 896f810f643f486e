package com.storyforge.orchestrator.dispatch;

/** Thrown from {@link CancellationToken#checkpoint()} once the job has been cancelled. */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
