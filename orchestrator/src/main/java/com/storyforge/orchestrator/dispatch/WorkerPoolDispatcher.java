package com.storyforge.orchestrator.dispatch;

import com.storyforge.orchestrator.error.DispatchException;
import com.storyforge.orchestrator.model.StageType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-process {@link TaskDispatcher} backed by a fixed worker pool.
 *
 * Why a fixed pool?
 *   Generation calls are slow and rate-limited upstream. A bounded pool caps
 *   how many run at once; extra jobs wait in the pool's queue as PENDING.
 *
 * Handles live in a map until a periodic sweep evicts finished ones, after
 * which status() reports them as PENDING like a queue that never saw them.
 *
 * Runners are looked up lazily because they depend (through the completion
 * services) on the dispatcher itself.
 */
@Component
@EnableScheduling
public class WorkerPoolDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolDispatcher.class);

    private static final String STAGE_KIND_PREFIX = "stage:";

    private final ExecutorService          workers;
    private final ScheduledExecutorService delays;
    private final Map<String, JobRecord>   jobs = new ConcurrentHashMap<>();

    private final ObjectProvider<StageJobRunner>    stageRunner;
    private final ObjectProvider<WorkflowJobRunner> workflowRunner;
    private final MeterRegistry                     meterRegistry;
    private final Duration                          workflowSoftTimeLimit;
    private final Duration                          retention;
    private final Clock                             clock;

    @Autowired
    public WorkerPoolDispatcher(ObjectProvider<StageJobRunner> stageRunner,
                                ObjectProvider<WorkflowJobRunner> workflowRunner,
                                MeterRegistry meterRegistry,
                                @Value("${storyforge.dispatch.worker-count:4}") int workerCount,
                                @Value("${storyforge.workflow.soft-time-limit:PT1H}") Duration workflowSoftTimeLimit,
                                @Value("${storyforge.dispatch.handle-retention:PT1H}") Duration retention) {
        this(stageRunner, workflowRunner, meterRegistry, workerCount,
                workflowSoftTimeLimit, retention, Clock.systemUTC());
    }

    WorkerPoolDispatcher(ObjectProvider<StageJobRunner> stageRunner,
                         ObjectProvider<WorkflowJobRunner> workflowRunner,
                         MeterRegistry meterRegistry,
                         int workerCount,
                         Duration workflowSoftTimeLimit,
                         Duration retention,
                         Clock clock) {
        this.stageRunner           = stageRunner;
        this.workflowRunner        = workflowRunner;
        this.meterRegistry         = meterRegistry;
        this.workflowSoftTimeLimit = workflowSoftTimeLimit;
        this.retention             = retention;
        this.clock                 = clock;
        this.workers = Executors.newFixedThreadPool(workerCount, new CustomizableThreadFactory("stage-worker-"));
        this.delays  = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("job-delay-"));
        log.info("Worker pool started with {} workers", workerCount);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    @Override
    public String submit(StageType stageType, UUID projectId, Map<String, Object> input, String userId) {
        return submit(stageType, projectId, input, userId, Duration.ZERO);
    }

    @Override
    public String submit(StageType stageType, UUID projectId, Map<String, Object> input,
                         String userId, Duration delay) {
        String handle = newHandle();
        StageJob job = new StageJob(handle, stageType, projectId, input == null ? Map.of() : input, userId);
        JobRecord record = new JobRecord(handle, STAGE_KIND_PREFIX + stageType.value(),
                new CancellationToken(stageType.softTimeLimit(), clock),
                token -> stageRunner.getObject().run(job, token),
                reason -> stageRunner.getObject().abandon(job, reason));
        enqueue(record, delay);
        log.info("Submitted {} job {} for project {} (delay={}s)",
                stageType.value(), handle, projectId, delay.toSeconds());
        return handle;
    }

    @Override
    public String submitWorkflow(UUID projectId, UUID executionId) {
        String handle = newHandle();
        WorkflowJob job = new WorkflowJob(handle, projectId, executionId);
        JobRecord record = new JobRecord(handle, "workflow",
                new CancellationToken(workflowSoftTimeLimit, clock),
                token -> workflowRunner.getObject().run(job, token),
                reason -> workflowRunner.getObject().abandon(job, reason));
        enqueue(record, Duration.ZERO);
        log.info("Submitted workflow job {} for execution {}", handle, executionId);
        return handle;
    }

    // ------------------------------------------------------------------
    // Status / cancel
    // ------------------------------------------------------------------

    @Override
    public JobStatus status(String handle) {
        JobRecord record = jobs.get(handle);
        return record == null ? JobStatus.PENDING : record.status;
    }

    @Override
    public boolean cancel(String handle) {
        JobRecord record = jobs.get(handle);
        if (record == null) {
            log.warn("Cancel requested for unknown job {}", handle);
            return false;
        }
        record.token.cancel();
        log.info("Cancellation flagged for job {} (status={})", handle, record.status);
        return true;
    }

    @Override
    public Set<String> activeStageHandles() {
        return jobs.values().stream()
                .filter(r -> r.kind.startsWith(STAGE_KIND_PREFIX) && r.finishedAt == null)
                .map(r -> r.handle)
                .collect(Collectors.toSet());
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /** Forget finished jobs older than the retention window. */
    @Scheduled(fixedDelayString = "${storyforge.dispatch.eviction-interval-ms:60000}")
    public void evictFinished() {
        Instant cutoff = clock.instant().minus(retention);
        int before = jobs.size();
        jobs.values().removeIf(r -> r.finishedAt != null && r.finishedAt.isBefore(cutoff));
        int evicted = before - jobs.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished job handles", evicted);
        }
    }

    @PreDestroy
    public void shutdown() {
        delays.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    /**
     * Register the job and start it once the surrounding transaction commits.
     * On rollback the handle is dropped and the job never runs. A refusal at
     * commit time propagates to the committing caller.
     */
    private void enqueue(JobRecord record, Duration delay) {
        jobs.put(record.handle, record);
        meterRegistry.counter("storyforge.jobs.submitted", "kind", record.kind).increment();

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    start(record, delay);
                }

                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        jobs.remove(record.handle);
                        log.debug("Dropped job {} after rollback", record.handle);
                    }
                }
            });
        } else {
            start(record, delay);
        }
    }

    private void start(JobRecord record, Duration delay) {
        try {
            if (delay.isZero() || delay.isNegative()) {
                workers.submit(() -> execute(record));
            } else {
                delays.schedule(() -> {
                    try {
                        workers.submit(() -> execute(record));
                    } catch (RejectedExecutionException e) {
                        log.error("Worker pool rejected delayed job {}", record.handle);
                        record.finish(JobStatus.FAILURE, clock);
                        try {
                            record.onAbandoned.accept("Worker pool rejected delayed job " + record.handle);
                        } catch (RuntimeException abandonFailure) {
                            log.error("Could not record rejection of job {}; stalled-stage recovery will fail it",
                                    record.handle, abandonFailure);
                        }
                    }
                }, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            record.finish(JobStatus.FAILURE, clock);
            DispatchException failure = new DispatchException("Worker pool rejected job " + record.handle, e);
            try {
                record.onAbandoned.accept(failure.getMessage());
            } catch (RuntimeException abandonFailure) {
                failure.addSuppressed(abandonFailure);
            }
            throw failure;
        }
    }

    private void execute(JobRecord record) {
        if (record.token.isCancelled()) {
            log.info("Job {} cancelled before it started", record.handle);
            record.finish(JobStatus.FAILURE, clock);
            return;
        }
        record.status = JobStatus.RUNNING;
        record.token.arm();

        Timer.Sample sample = Timer.start(meterRegistry);
        JobStatus outcome = JobStatus.FAILURE;
        try {
            outcome = record.body.apply(record.token);
        } catch (JobCancelledException e) {
            log.info("Job {} stopped at a cancellation checkpoint", record.handle);
        } catch (Exception e) {
            // Runners report their own failures; reaching here means that
            // report failed too. The stage is left to stalled-stage recovery.
            log.error("Unhandled error in job {}: {}", record.handle, e.getMessage(), e);
        } finally {
            record.finish(outcome, clock);
            sample.stop(meterRegistry.timer("storyforge.jobs.duration",
                    "kind", record.kind, "status", outcome.apiState()));
        }
    }

    private static String newHandle() {
        return UUID.randomUUID().toString();
    }

    private static final class JobRecord {
        final String                               handle;
        final String                               kind;
        final CancellationToken                    token;
        final Function<CancellationToken, JobStatus> body;
        final Consumer<String>                       onAbandoned;

        volatile JobStatus status = JobStatus.PENDING;
        volatile Instant   finishedAt;

        JobRecord(String handle, String kind, CancellationToken token,
                  Function<CancellationToken, JobStatus> body,
                  Consumer<String> onAbandoned) {
            this.handle      = handle;
            this.kind        = kind;
            this.token       = token;
            this.body        = body;
            this.onAbandoned = onAbandoned;
        }

        void finish(JobStatus outcome, Clock clock) {
            this.status     = outcome;
            this.finishedAt = clock.instant();
        }
    }
}
