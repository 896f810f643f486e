package com.storyforge.orchestrator.store;

import com.storyforge.orchestrator.model.Project;
import com.storyforge.orchestrator.model.ProjectStatus;
import com.storyforge.orchestrator.model.Stage;
import com.storyforge.orchestrator.model.StageType;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persistence boundary for projects and their pipeline stages.
 *
 * Every method that changes a status does its check and its write as one
 * atomic step against the row, and reports through its return value whether
 * this caller won. Callers never check-then-write on their own.
 */
public interface StageStateStore {

    /** Create a DRAFT project with one PENDING stage per pipeline entry, in pipeline order. */
    Project createProject(String name, String ownerId);

    Optional<Project> findProject(UUID projectId);

    Optional<Stage> findStage(UUID projectId, StageType stageType);

    /** All stages of a project in pipeline order. */
    List<Stage> listStages(UUID projectId);

    /** PENDING or FAILED stages, ordered by creation time ascending. */
    List<Stage> listResumableStages(UUID projectId);

    /**
     * Apply {@code mutation} to the stage under a row lock and persist it.
     *
     * @return the updated stage
     */
    Stage updateStage(UUID stageId, Consumer<Stage> mutation);

    /** Conditional project status change; false if the current status is not in {@code from}. */
    boolean transitionProject(UUID projectId, Set<ProjectStatus> from, ProjectStatus to);

    /** Flip a stage to PROCESSING (clearing handle and error) unless it already is. */
    boolean claimStage(UUID stageId);

    /** As {@link #claimStage}, also incrementing retry_count; false once retries are exhausted. */
    boolean claimStageForRetry(UUID stageId);

    /** Record the job handle of a stage that is PROCESSING; also refreshes its heartbeat. */
    boolean assignHandle(UUID stageId, String jobHandle);

    /**
     * Refresh the heartbeat of every PROCESSING stage owned by one of these handles.
     *
     * @return number of stages touched
     */
    int touchHeartbeats(Collection<String> jobHandles);

    /** PROCESSING stages whose heartbeat (or start, if never touched) is older than {@code cutoff}. */
    List<Stage> listStalledStages(Instant cutoff);
}
