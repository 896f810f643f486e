package com.storyforge.orchestrator.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.dispatch.CancellationToken;
import com.storyforge.orchestrator.dispatch.JobCancelledException;
import com.storyforge.orchestrator.dispatch.JobStatus;
import com.storyforge.orchestrator.dispatch.WorkflowJob;
import com.storyforge.orchestrator.dispatch.WorkflowJobRunner;
import com.storyforge.orchestrator.model.ExecutionStatus;
import com.storyforge.orchestrator.progress.ProgressEvent;
import com.storyforge.orchestrator.progress.ProgressPublisher;
import com.storyforge.orchestrator.service.WorkflowExecutionRecorder;
import com.storyforge.orchestrator.service.WorkflowExecutionRecorder.RunContext;
import com.storyforge.orchestrator.service.WorkflowService;
import com.storyforge.orchestrator.workflow.NodeProgressListener;
import com.storyforge.orchestrator.workflow.NodeResult;
import com.storyforge.orchestrator.workflow.NodeStatus;
import com.storyforge.orchestrator.workflow.NodeTypeRegistry;
import com.storyforge.orchestrator.workflow.WorkflowEngine;
import com.storyforge.orchestrator.workflow.WorkflowGraph;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one workflow execution on a dispatcher worker thread.
 *
 * Flow:
 *   1. Mark the execution running and load any results it was seeded with
 *   2. Load and sort the graph; skip the completed prefix when resuming
 *   3. Run the remaining nodes, persisting each result as it lands
 *   4. Close the execution as completed, failed or cancelled and publish done / error
 */
@Component
public class WorkflowRunner implements WorkflowJobRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final NodeTypeRegistry          registry;
    private final WorkflowExecutionRecorder recorder;
    private final ProgressPublisher         publisher;
    private final ObjectMapper              json;
    private final MeterRegistry             meterRegistry;

    public WorkflowRunner(NodeTypeRegistry registry,
                          WorkflowExecutionRecorder recorder,
                          ProgressPublisher publisher,
                          ObjectMapper json,
                          MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.recorder      = recorder;
        this.publisher     = publisher;
        this.json          = json;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public JobStatus run(WorkflowJob job, CancellationToken token) {
        MDC.put("projectId",   job.projectId().toString());
        MDC.put("executionId", job.executionId().toString());
        MDC.put("jobHandle",   job.handle());
        try {
            Optional<RunContext> started = recorder.start(job);
            if (started.isEmpty()) {
                return JobStatus.FAILURE;
            }
            RunContext ctx = started.get();
            publish(job, ProgressEvent.stageUpdate("running", 0, "Workflow execution started"));

            try {
                WorkflowEngine engine = new WorkflowEngine(registry);
                engine.load(WorkflowGraph.parse(ctx.graphJson(), json));
                List<String> order = engine.topologicalSort();
                NodeProgressListener listener = new Listener(job, ctx, order.size());

                String resumePoint = engine.resumePoint(ctx.prior());
                Map<String, NodeResult> results = resumePoint == null
                        ? engine.execute(listener, token)
                        : engine.resumeFrom(resumePoint, ctx.prior(), listener, token);

                recorder.finish(job.executionId(), ExecutionStatus.COMPLETED, null);
                Map<String, Object> outputs = new LinkedHashMap<>();
                results.forEach((id, r) -> outputs.put(id, r.outputsAsMap()));
                publish(job, ProgressEvent.stageUpdate("completed", 100, "Workflow execution completed"));
                publish(job, ProgressEvent.done(outputs, Map.of(
                        "execution_id", job.executionId().toString(),
                        "node_count",   order.size())));
                log.info("Workflow execution completed ({} nodes)", order.size());
                return JobStatus.SUCCESS;

            } catch (JobCancelledException e) {
                recorder.finish(job.executionId(), ExecutionStatus.CANCELLED, null);
                log.info("Workflow execution cancelled");
                return JobStatus.FAILURE;
            } catch (RuntimeException e) {
                String message = e.getMessage() == null ? e.toString() : e.getMessage();
                recorder.finish(job.executionId(), ExecutionStatus.FAILED, message);
                publish(job, ProgressEvent.error(message, 0));
                log.error("Workflow execution failed: {}", message);
                return JobStatus.FAILURE;
            }
        } catch (RuntimeException e) {
            log.error("Workflow job failed outside the engine", e);
            abandon(job, "Unhandled error: " + e);
            return JobStatus.FAILURE;
        } finally {
            MDC.clear();
        }
    }

    @Override
    public void abandon(WorkflowJob job, String reason) {
        if (recorder.abandon(job.executionId(), reason)) {
            publish(job, ProgressEvent.error(reason, 0));
        }
    }

    private void publish(WorkflowJob job, ProgressEvent event) {
        publisher.publish(job.projectId(), WorkflowService.CHANNEL_STAGE, event);
    }

    /** Persists and publishes node transitions; times each node. */
    private final class Listener implements NodeProgressListener {

        private final WorkflowJob               job;
        private final RunContext                ctx;
        private final int                       total;
        private final Map<String, Timer.Sample> timers = new HashMap<>();
        private int finished;

        Listener(WorkflowJob job, RunContext ctx, int total) {
            this.job      = job;
            this.ctx      = ctx;
            this.total    = total;
            this.finished = ctx.prior().size();
        }

        @Override
        public void onNode(String nodeId, NodeStatus status, NodeResult result) {
            if (status == NodeStatus.RUNNING) {
                timers.put(nodeId, Timer.start(meterRegistry));
                recorder.nodeStarted(job.executionId(), ctx.workflowId(), nodeId);
                publish(job, ProgressEvent.stageUpdate("running", percent(), "Executing node " + nodeId));
                return;
            }
            Timer.Sample sample = timers.remove(nodeId);
            if (sample != null) {
                sample.stop(meterRegistry.timer("storyforge.workflow.node.duration",
                        "status", status.name().toLowerCase(Locale.ROOT)));
            }
            recorder.nodeFinished(job.executionId(), nodeId, result);
            if (status == NodeStatus.COMPLETED) {
                finished++;
                publish(job, ProgressEvent.stageUpdate("running", percent(), "Node " + nodeId + " completed"));
            }
        }

        private int percent() {
            return total == 0 ? 100 : Math.min(100, finished * 100 / total);
        }
    }
}
