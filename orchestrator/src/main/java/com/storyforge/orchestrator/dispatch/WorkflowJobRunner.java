package com.storyforge.orchestrator.dispatch;

/** Worker-side body of a workflow execution job. */
public interface WorkflowJobRunner {

    JobStatus run(WorkflowJob job, CancellationToken token);

    /** Close the execution of a job that will never run. */
    void abandon(WorkflowJob job, String reason);
}
