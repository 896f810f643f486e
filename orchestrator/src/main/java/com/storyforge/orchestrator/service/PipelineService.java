package com.storyforge.orchestrator.service;

import com.storyforge.orchestrator.dispatch.JobStatus;
import com.storyforge.orchestrator.dispatch.TaskDispatcher;
import com.storyforge.orchestrator.error.ErrorCode;
import com.storyforge.orchestrator.error.NotFoundException;
import com.storyforge.orchestrator.error.StateConflictException;
import com.storyforge.orchestrator.model.*;
import com.storyforge.orchestrator.progress.ProgressChannels;
import com.storyforge.orchestrator.store.StageStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Request-path control of the content pipeline: execute, pause, resume,
 * retry and rollback of stages.
 *
 * Every mutating method is @Transactional and performs its status check and
 * status write as one conditional update in the store, so two concurrent
 * callers can never both win the same transition. Jobs submitted inside the
 * transaction only start after it commits; if anything later in the method
 * throws, the transaction rolls back and the job never runs.
 *
 * Nothing here waits for generation work. Outcomes are written back by
 * StageCompletionService on the worker side.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final StageStateStore store;
    private final TaskDispatcher  dispatcher;

    public PipelineService(StageStateStore store, TaskDispatcher dispatcher) {
        this.store      = store;
        this.dispatcher = dispatcher;
    }

    // ------------------------------------------------------------------
    // Result types
    // ------------------------------------------------------------------

    public record Dispatch(UUID projectId, StageType stage, String jobHandle, String channel) {}

    public record CancelledTask(StageType stage, String jobHandle) {}

    public record PauseResult(Project project, List<CancelledTask> cancelled) {}

    /**
     * Outcome of resume(). Exactly one of: a fresh dispatch, an already-running
     * stage (dispatch holds its existing handle), or all stages completed.
     */
    public record ResumeResult(Project project, Dispatch dispatch, Instant resumedAt,
                               boolean alreadyRunning, boolean allStagesCompleted) {}

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    @Transactional
    public Project createProject(String name, String ownerId) {
        Project project = store.createProject(name, ownerId);
        log.info("Project {} created for owner {}", project.getId(), ownerId);
        return project;
    }

    @Transactional(readOnly = true)
    public Project getProject(UUID projectId) {
        return requireProject(projectId);
    }

    @Transactional(readOnly = true)
    public List<Stage> listStages(UUID projectId) {
        requireProject(projectId);
        return store.listStages(projectId);
    }

    // ------------------------------------------------------------------
    // execute_stage
    // ------------------------------------------------------------------

    /**
     * Dispatch one stage with the given input.
     *
     * Order matters: the stage claim is the mutual exclusion, and the project
     * is PROCESSING before the job is submitted.
     */
    @Transactional
    public Dispatch executeStage(UUID projectId, String stageName, Map<String, Object> input) {
        StageType type = StageType.fromName(stageName);
        Project project = requireProject(projectId);
        if (!ProjectStatus.EXECUTABLE.contains(project.getStatus())) {
            throw new StateConflictException(ErrorCode.PROJECT_INVALID_STATUS,
                    "Project " + projectId + " is " + project.getStatus().value() + "; stages cannot be executed");
        }
        Stage stage = requireStage(projectId, type);

        if (!store.claimStage(stage.getId())) {
            throw new StateConflictException(ErrorCode.STAGE_ALREADY_PROCESSING,
                    "Stage " + type.value() + " is already processing");
        }
        if (!store.transitionProject(projectId, ProjectStatus.EXECUTABLE, ProjectStatus.PROCESSING)) {
            throw new StateConflictException(ErrorCode.PROJECT_INVALID_STATUS,
                    "Project " + projectId + " changed status concurrently");
        }
        Map<String, Object> stored = input == null ? Map.of() : input;
        store.updateStage(stage.getId(), s -> s.setInputData(stored));

        String handle = dispatcher.submit(type, projectId, stored, project.getOwnerId());
        store.assignHandle(stage.getId(), handle);
        log.info("Dispatched {} for project {} as job {}", type.value(), projectId, handle);
        return dispatch(projectId, type, handle);
    }

    // ------------------------------------------------------------------
    // pause
    // ------------------------------------------------------------------

    /**
     * Pause a processing project and ask every running stage job to stop.
     *
     * Cancellation is cooperative, so the returned list holds attempts, not
     * confirmed stops. Each cancelled stage goes back to PENDING without a
     * handle: resume() re-runs it, and a job that completes anyway no longer
     * owns the stage and is discarded.
     */
    @Transactional
    public PauseResult pause(UUID projectId) {
        requireProject(projectId);
        if (!store.transitionProject(projectId, EnumSet.of(ProjectStatus.PROCESSING), ProjectStatus.PAUSED)) {
            throw new StateConflictException(ErrorCode.PROJECT_NOT_PAUSABLE,
                    "Only a processing project can be paused");
        }

        List<CancelledTask> cancelled = new ArrayList<>();
        for (Stage stage : store.listStages(projectId)) {
            String handle = stage.getJobHandle();
            if (stage.getStatus() != StageStatus.PROCESSING || handle == null) {
                continue;
            }
            try {
                dispatcher.cancel(handle);
            } catch (RuntimeException e) {
                log.warn("Cancel of job {} ({}) failed: {}", handle, stage.getStageType().value(), e.getMessage());
            }
            store.updateStage(stage.getId(), s -> {
                if (s.getStatus() == StageStatus.PROCESSING && Objects.equals(s.getJobHandle(), handle)) {
                    s.resetToPending(false);
                }
            });
            cancelled.add(new CancelledTask(stage.getStageType(), handle));
        }
        log.info("Project {} paused; {} job(s) asked to cancel", projectId, cancelled.size());
        return new PauseResult(requireProject(projectId), cancelled);
    }

    // ------------------------------------------------------------------
    // resume
    // ------------------------------------------------------------------

    /**
     * Continue a paused project from its earliest pending or failed stage.
     *
     * The PAUSED to PROCESSING transition decides between concurrent resumes.
     * A caller that loses it, or that loses the stage claim afterwards, gets
     * the running stage's existing handle and dispatches nothing.
     */
    @Transactional
    public ResumeResult resume(UUID projectId) {
        Project project = requireProject(projectId);
        if (project.getStatus() != ProjectStatus.PAUSED) {
            throw new StateConflictException(ErrorCode.PROJECT_NOT_RESUMABLE,
                    "Only a paused project can be resumed (status is " + project.getStatus().value() + ")");
        }

        List<Stage> resumable = store.listResumableStages(projectId);
        if (resumable.isEmpty()) {
            if (!store.transitionProject(projectId, EnumSet.of(ProjectStatus.PAUSED), ProjectStatus.COMPLETED)) {
                throw new StateConflictException(ErrorCode.PROJECT_NOT_RESUMABLE,
                        "Project " + projectId + " changed status concurrently");
            }
            log.info("Project {} has no stage left to run; marked completed", projectId);
            return new ResumeResult(requireProject(projectId), null, null, false, true);
        }

        Stage next = resumable.get(0);
        StageType type = next.getStageType();
        if (!store.transitionProject(projectId, EnumSet.of(ProjectStatus.PAUSED), ProjectStatus.PROCESSING)) {
            return alreadyRunning(projectId, type);
        }
        if (!store.claimStage(next.getId())) {
            return alreadyRunning(projectId, type);
        }

        Map<String, Object> input = next.getInputData() == null ? Map.of() : next.getInputData();
        String handle = dispatcher.submit(type, projectId, input, project.getOwnerId());
        store.assignHandle(next.getId(), handle);
        log.info("Resumed project {} at {} as job {}", projectId, type.value(), handle);
        return new ResumeResult(requireProject(projectId), dispatch(projectId, type, handle),
                Instant.now(), false, false);
    }

    /**
     * A concurrent caller got there first. Report the stage it is running;
     * if the project left PAUSED for anything but PROCESSING, it is no longer
     * resumable.
     */
    private ResumeResult alreadyRunning(UUID projectId, StageType expected) {
        Project project = requireProject(projectId);
        if (project.getStatus() != ProjectStatus.PROCESSING) {
            throw new StateConflictException(ErrorCode.PROJECT_NOT_RESUMABLE,
                    "Project " + projectId + " changed to " + project.getStatus().value() + " during resume");
        }
        Stage running = requireStage(projectId, expected);
        if (running.getStatus() != StageStatus.PROCESSING) {
            running = store.listStages(projectId).stream()
                    .filter(s -> s.getStatus() == StageStatus.PROCESSING)
                    .findFirst()
                    .orElse(running);
        }
        log.info("Resume of project {} found {} already running as job {}",
                projectId, running.getStageType().value(), running.getJobHandle());
        return new ResumeResult(project, dispatch(projectId, running.getStageType(), running.getJobHandle()),
                null, true, false);
    }

    // ------------------------------------------------------------------
    // retry_stage
    // ------------------------------------------------------------------

    /**
     * Manually re-run a stage with its stored input, consuming one retry.
     * Rejected once retry_count has reached max_retries.
     */
    @Transactional
    public Dispatch retryStage(UUID projectId, String stageName) {
        StageType type = StageType.fromName(stageName);
        Project project = requireProject(projectId);
        Stage stage = requireStage(projectId, type);

        if (!stage.hasRetriesLeft()) {
            throw new StateConflictException(ErrorCode.STAGE_MAX_RETRIES_EXCEEDED,
                    "Stage " + type.value() + " has used all " + stage.getMaxRetries() + " retries");
        }
        if (!store.claimStageForRetry(stage.getId())) {
            Stage now = requireStage(projectId, type);
            if (now.getStatus() == StageStatus.PROCESSING) {
                throw new StateConflictException(ErrorCode.STAGE_ALREADY_PROCESSING,
                        "Stage " + type.value() + " is already processing");
            }
            throw new StateConflictException(ErrorCode.STAGE_MAX_RETRIES_EXCEEDED,
                    "Stage " + type.value() + " has used all " + now.getMaxRetries() + " retries");
        }
        store.transitionProject(projectId, EnumSet.allOf(ProjectStatus.class), ProjectStatus.PROCESSING);

        Map<String, Object> input = stage.getInputData() == null ? Map.of() : stage.getInputData();
        String handle = dispatcher.submit(type, projectId, input, project.getOwnerId());
        store.assignHandle(stage.getId(), handle);
        log.info("Retrying {} for project {} as job {} (retry {}/{})",
                type.value(), projectId, handle, stage.getRetryCount() + 1, stage.getMaxRetries());
        return dispatch(projectId, type, handle);
    }

    // ------------------------------------------------------------------
    // rollback_stage
    // ------------------------------------------------------------------

    /**
     * Reset a stage and every later stage to PENDING, clearing their results,
     * and put the project back to DRAFT. Live jobs of the reset stages are
     * cancelled; whatever they report afterwards is discarded.
     */
    @Transactional
    public Project rollbackStage(UUID projectId, String stageName) {
        StageType type = StageType.fromName(stageName);
        requireProject(projectId);
        requireStage(projectId, type);

        int reset = 0;
        for (Stage stage : store.listStages(projectId)) {
            if (stage.getStageType().ordinal() < type.ordinal()) {
                continue;
            }
            if (stage.getStatus() == StageStatus.PROCESSING && stage.getJobHandle() != null) {
                dispatcher.cancel(stage.getJobHandle());
            }
            store.updateStage(stage.getId(), s -> s.resetToPending(true));
            reset++;
        }
        store.transitionProject(projectId, EnumSet.allOf(ProjectStatus.class), ProjectStatus.DRAFT);
        log.info("Rolled back project {} from {} ({} stages reset)", projectId, type.value(), reset);
        return requireProject(projectId);
    }

    // ------------------------------------------------------------------
    // task status
    // ------------------------------------------------------------------

    public JobStatus taskStatus(UUID projectId, String jobHandle) {
        return dispatcher.status(jobHandle);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Project requireProject(UUID projectId) {
        return store.findProject(projectId).orElseThrow(() -> NotFoundException.project(projectId));
    }

    private Stage requireStage(UUID projectId, StageType type) {
        return store.findStage(projectId, type).orElseThrow(() -> NotFoundException.stage(projectId, type.value()));
    }

    private static Dispatch dispatch(UUID projectId, StageType type, String handle) {
        return new Dispatch(projectId, type, handle, ProgressChannels.channel(projectId, type.value()));
    }
}
