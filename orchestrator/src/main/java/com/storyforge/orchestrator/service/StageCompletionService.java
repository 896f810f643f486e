package com.storyforge.orchestrator.service;

import com.storyforge.orchestrator.dispatch.JobStatus;
import com.storyforge.orchestrator.dispatch.StageJob;
import com.storyforge.orchestrator.dispatch.TaskDispatcher;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.model.*;
import com.storyforge.orchestrator.store.StageStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker-side state transitions for pipeline stages.
 *
 * A job may only write its outcome while the stage is still PROCESSING
 * under the same job handle. Anything else means the job was cancelled,
 * rolled back or superseded while it ran, and its outcome is discarded.
 * This is how a job that finishes after pause() is kept from overwriting
 * the paused state.
 */
@Service
public class StageCompletionService {

    private static final Logger log = LoggerFactory.getLogger(StageCompletionService.class);

    private final StageStateStore store;
    private final TaskDispatcher  dispatcher;
    private final Duration        backoffBase;
    private final Duration        backoffMax;

    public StageCompletionService(StageStateStore store,
                                  TaskDispatcher dispatcher,
                                  @Value("${storyforge.retry.backoff-base:PT60S}") Duration backoffBase,
                                  @Value("${storyforge.retry.backoff-max:PT10M}") Duration backoffMax) {
        this.store       = store;
        this.dispatcher  = dispatcher;
        this.backoffBase = backoffBase;
        this.backoffMax  = backoffMax;
    }

    /** What happened to a failed attempt. */
    public record FailureOutcome(JobStatus status, int retryCount, boolean discarded, String message) {}

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Confirm the job still owns its stage and collect the outputs of the
     * earlier completed stages it may build on.
     *
     * @return empty if the job is stale and must not run
     */
    @Transactional(readOnly = true)
    public Optional<Map<StageType, Map<String, Object>>> begin(StageJob job) {
        Optional<Stage> stage = store.findStage(job.projectId(), job.stageType());
        if (stage.isEmpty() || !ownedBy(stage.get(), job)) {
            log.warn("Skipping stale {} job {} for project {}",
                    job.stageType().value(), job.handle(), job.projectId());
            return Optional.empty();
        }
        Map<StageType, Map<String, Object>> upstream = new EnumMap<>(StageType.class);
        for (Stage s : store.listStages(job.projectId())) {
            if (s.getPosition() < stage.get().getPosition()
                    && s.getStatus() == StageStatus.COMPLETED
                    && s.getOutputData() != null) {
                upstream.put(s.getStageType(), s.getOutputData());
            }
        }
        return Optional.of(upstream);
    }

    // ------------------------------------------------------------------
    // Success
    // ------------------------------------------------------------------

    /**
     * Record a successful attempt. Completes the project once every stage is
     * done, provided the project is still PROCESSING.
     *
     * @return false if the outcome was discarded as stale
     */
    @Transactional
    public boolean completeStage(StageJob job, Map<String, Object> output) {
        Stage current = store.findStage(job.projectId(), job.stageType()).orElse(null);
        Project project = store.findProject(job.projectId()).orElse(null);
        if (current == null || project == null) {
            log.warn("Discarding completion of job {}: project or stage no longer exists", job.handle());
            return false;
        }
        // Ownership alone decides. A rollback of an earlier stage moves the
        // project out of PROCESSING but leaves this stage owned by the job.
        AtomicBoolean accepted = new AtomicBoolean(false);
        store.updateStage(current.getId(), stage -> {
            if (!ownedBy(stage, job)) {
                return;
            }
            stage.setStatus(StageStatus.COMPLETED);
            stage.setOutputData(output);
            stage.setErrorMessage(null);
            stage.setCompletedAt(Instant.now());
            accepted.set(true);
        });
        if (!accepted.get()) {
            log.warn("Discarding late completion of job {}: stage {} no longer owned by it",
                    job.handle(), job.stageType().value());
            return false;
        }

        log.info("Stage {} of project {} completed (job {})",
                job.stageType().value(), job.projectId(), job.handle());

        boolean allDone = store.listStages(job.projectId()).stream()
                .allMatch(s -> s.getStatus() == StageStatus.COMPLETED);
        if (allDone && store.transitionProject(job.projectId(),
                EnumSet.of(ProjectStatus.PROCESSING), ProjectStatus.COMPLETED)) {
            log.info("Project {} completed: all stages done", job.projectId());
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    /**
     * Record a failed attempt.
     *
     * The failure always costs one retry (capped at max_retries). Transient
     * failures with budget left are resubmitted after exponential backoff as a
     * new job and the stage stays PROCESSING under the new handle. Everything
     * else marks the stage and the project FAILED and waits for retryStage().
     */
    @Transactional
    public FailureOutcome failStage(StageJob job, JobExecutionException failure) {
        String message = failure.getMessage();
        Stage current = store.findStage(job.projectId(), job.stageType()).orElse(null);
        if (current == null) {
            return new FailureOutcome(JobStatus.FAILURE, 0, true, message);
        }

        AtomicBoolean owned      = new AtomicBoolean(false);
        AtomicBoolean retry      = new AtomicBoolean(false);
        AtomicInteger retryCount = new AtomicInteger();
        store.updateStage(current.getId(), stage -> {
            if (!ownedBy(stage, job)) {
                return;
            }
            owned.set(true);
            boolean budgetLeft = stage.hasRetriesLeft();
            if (budgetLeft) {
                stage.setRetryCount(stage.getRetryCount() + 1);
            }
            stage.setErrorMessage(message);
            retryCount.set(stage.getRetryCount());
            if (failure.isTransient() && budgetLeft) {
                retry.set(true);
            } else {
                stage.setStatus(StageStatus.FAILED);
                stage.setJobHandle(null);
            }
        });

        if (!owned.get()) {
            log.warn("Discarding late failure of job {}: {}", job.handle(), message);
            return new FailureOutcome(JobStatus.FAILURE, current.getRetryCount(), true, message);
        }

        if (retry.get()) {
            Duration delay = backoff(retryCount.get());
            String next = dispatcher.submit(job.stageType(), job.projectId(), job.input(), job.userId(), delay);
            store.assignHandle(current.getId(), next);
            log.warn("Stage {} of project {} failed ({}), retry {}/{} as job {} in {}s: {}",
                    job.stageType().value(), job.projectId(), failure.getCategory(),
                    retryCount.get(), current.getMaxRetries(), next, delay.toSeconds(), message);
            return new FailureOutcome(JobStatus.RETRYING, retryCount.get(), false, message);
        }

        store.transitionProject(job.projectId(), EnumSet.of(ProjectStatus.PROCESSING), ProjectStatus.FAILED);
        log.error("Stage {} of project {} failed ({}) after {} retries: {}",
                job.stageType().value(), job.projectId(), failure.getCategory(), retryCount.get(), message);
        return new FailureOutcome(JobStatus.FAILURE, retryCount.get(), false, message);
    }

    // ------------------------------------------------------------------
    // Abandoned and stalled jobs
    // ------------------------------------------------------------------

    /**
     * Fail the attempt of a job that will never report an outcome itself:
     * the queue refused it, or it died outside its processor. Runs in its own
     * transaction since the dispatcher calls it after the submitting
     * transaction has already committed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FailureOutcome abandonStage(StageJob job, String reason) {
        log.error("Stage job {} ({}) for project {} abandoned: {}",
                job.handle(), job.stageType().value(), job.projectId(), reason);
        return failStage(job, new JobExecutionException(Category.INTERNAL, reason));
    }

    /** A PROCESSING stage whose job stopped sending heartbeats, and what recovery did with it. */
    public record StalledStage(UUID projectId, StageType stageType, String jobHandle, FailureOutcome outcome) {}

    /**
     * Fail every PROCESSING stage whose heartbeat is older than
     * {@code stallTimeout}. The failure counts as a timeout, so a stage with
     * retries left is resubmitted.
     */
    @Transactional
    public List<StalledStage> recoverStalledStages(Duration stallTimeout) {
        Instant cutoff = Instant.now().minus(stallTimeout);
        String message = "Worker heartbeat timed out after " + stallTimeout.toMinutes() + " minutes";
        List<StalledStage> recovered = new ArrayList<>();
        for (Stage stage : store.listStalledStages(cutoff)) {
            Project project = stage.getProject();
            log.warn("Recovering stalled {} of project {} (job={}, last heartbeat={})",
                    stage.getStageType().value(), project.getId(), stage.getJobHandle(), stage.getHeartbeatAt());
            StageJob job = new StageJob(stage.getJobHandle(), stage.getStageType(), project.getId(),
                    stage.getInputData() == null ? Map.of() : stage.getInputData(), project.getOwnerId());
            FailureOutcome outcome = failStage(job, new JobExecutionException(Category.TIMEOUT, message));
            recovered.add(new StalledStage(project.getId(), stage.getStageType(), stage.getJobHandle(), outcome));
        }
        return recovered;
    }

    /** base * 2^(attempt-1), capped. */
    Duration backoff(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = backoffBase.multipliedBy(1L << shift);
        return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
    }

    private static boolean ownedBy(Stage stage, StageJob job) {
        return stage.getStatus() == StageStatus.PROCESSING
                && Objects.equals(stage.getJobHandle(), job.handle());
    }
}
