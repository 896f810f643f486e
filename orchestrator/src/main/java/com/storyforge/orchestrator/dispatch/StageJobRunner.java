package com.storyforge.orchestrator.dispatch;

/**
 * Worker-side body of a stage job. Reports its own outcome to the state
 * store and returns the final queue status for the task-status endpoint.
 */
public interface StageJobRunner {

    JobStatus run(StageJob job, CancellationToken token);

    /**
     * Record the outcome of a job that will never run, e.g. because the
     * worker pool refused it after the submitting transaction committed.
     */
    void abandon(StageJob job, String reason);
}
