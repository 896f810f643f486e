package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.dispatch.CancellationToken;
import com.storyforge.orchestrator.dispatch.JobCancelledException;
import com.storyforge.orchestrator.dispatch.JobStatus;
import com.storyforge.orchestrator.dispatch.StageJob;
import com.storyforge.orchestrator.dispatch.StageJobRunner;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.model.StageType;
import com.storyforge.orchestrator.progress.ProgressEvent;
import com.storyforge.orchestrator.progress.ProgressPublisher;
import com.storyforge.orchestrator.service.StageCompletionService;
import com.storyforge.orchestrator.service.StageCompletionService.FailureOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Runs one attempt of a pipeline stage on a dispatcher worker thread.
 *
 * Flow:
 *   1. Confirm the job still owns its stage (a cancelled or superseded job stops here)
 *   2. Publish stage_update(processing)
 *   3. Run the stage's processor
 *   4. Report the outcome to StageCompletionService, then publish done / error
 *
 * Outcomes are only published after the completion service accepted them,
 * so subscribers never see "done" for a result that was discarded. An error
 * outside the processor (a failed state write, a refused resubmission) still
 * fails the stage through {@link #abandon}.
 */
@Component
public class StageWorker implements StageJobRunner {

    private static final Logger log = LoggerFactory.getLogger(StageWorker.class);

    private final StageProcessorRegistry processors;
    private final StageCompletionService completion;
    private final ProgressPublisher      publisher;

    public StageWorker(StageProcessorRegistry processors,
                       StageCompletionService completion,
                       ProgressPublisher publisher) {
        this.processors = processors;
        this.completion = completion;
        this.publisher  = publisher;
    }

    @Override
    public JobStatus run(StageJob job, CancellationToken token) {
        // Every log line from this worker thread carries the job's identity.
        MDC.put("projectId", job.projectId().toString());
        MDC.put("stage",     job.stageType().value());
        MDC.put("jobHandle", job.handle());
        try {
            Optional<Map<StageType, Map<String, Object>>> upstream = completion.begin(job);
            if (upstream.isEmpty()) {
                return JobStatus.FAILURE;
            }
            StageContext ctx = new StageContext(job, upstream.get(), token, publisher);
            ctx.publish(ProgressEvent.stageUpdate("processing", 0,
                    "Starting " + job.stageType().displayName()));

            Map<String, Object> output;
            try {
                ctx.checkpoint();
                output = processors.get(job.stageType()).process(ctx);
            } catch (JobCancelledException e) {
                log.info("Stage job cancelled at a checkpoint");
                return JobStatus.FAILURE;
            } catch (JobExecutionException e) {
                return fail(ctx, job, e);
            } catch (RuntimeException e) {
                log.error("Unexpected error in stage processor", e);
                return fail(ctx, job, new JobExecutionException(Category.INTERNAL, e.toString(), e));
            }

            // Past the last checkpoint: the result is reported even if a cancel
            // arrived meanwhile; the completion service decides whether it counts.
            if (completion.completeStage(job, output)) {
                ctx.publish(ProgressEvent.stageUpdate("completed", 100,
                        job.stageType().displayName() + " completed"));
                ctx.publish(ProgressEvent.done(output, Map.of("stage", job.stageType().value())));
                return JobStatus.SUCCESS;
            }
            return JobStatus.FAILURE;
        } catch (RuntimeException e) {
            log.error("Stage job failed outside its processor", e);
            abandon(job, "Unhandled error: " + e);
            return JobStatus.FAILURE;
        } finally {
            // Pool threads are reused; clear so context does not leak into the next job.
            MDC.clear();
        }
    }

    @Override
    public void abandon(StageJob job, String reason) {
        FailureOutcome outcome = completion.abandonStage(job, reason);
        if (!outcome.discarded()) {
            publisher.publish(job.projectId(), job.stageType().value(),
                    ProgressEvent.error(outcome.message(), outcome.retryCount()));
        }
    }

    private JobStatus fail(StageContext ctx, StageJob job, JobExecutionException e) {
        FailureOutcome outcome = completion.failStage(job, e);
        if (!outcome.discarded()) {
            ctx.publish(ProgressEvent.error(outcome.message(), outcome.retryCount()));
        }
        return outcome.status();
    }
}
