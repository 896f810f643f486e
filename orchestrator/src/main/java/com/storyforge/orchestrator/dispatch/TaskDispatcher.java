package com.storyforge.orchestrator.dispatch;

import com.storyforge.orchestrator.error.DispatchException;
import com.storyforge.orchestrator.model.StageType;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Asynchronous job queue seen from the request path.
 *
 * Submitting returns a handle immediately; nothing here blocks on
 * generation latency. When called inside a transaction the job does not
 * start before that transaction commits, so a worker always sees the state
 * the submitter wrote.
 */
public interface TaskDispatcher {

    /**
     * Queue one attempt of a pipeline stage.
     *
     * Inside a transaction the refusal can only surface at commit: the job's
     * runner is told to abandon it and the commit fails with the same
     * exception.
     *
     * @throws DispatchException if the queue refuses the job
     */
    String submit(StageType stageType, UUID projectId, Map<String, Object> input, String userId);

    /** As {@link #submit(StageType, UUID, Map, String)}, starting no earlier than {@code delay} from now. */
    String submit(StageType stageType, UUID projectId, Map<String, Object> input, String userId, Duration delay);

    /** Queue a workflow execution. */
    String submitWorkflow(UUID projectId, UUID executionId);

    /** Current status; handles the queue has never seen (or has forgotten) report PENDING. */
    JobStatus status(String handle);

    /**
     * Best-effort cooperative cancellation.
     *
     * @return true if the handle was known and its token was flagged; the job
     *         may still complete if it is past its last checkpoint
     */
    boolean cancel(String handle);

    /** Handles of stage jobs this queue holds and has not finished: queued, delayed or running. */
    Set<String> activeStageHandles();
}
