package com.storyforge.orchestrator.service;

import com.storyforge.orchestrator.dispatch.WorkflowJob;
import com.storyforge.orchestrator.model.ExecutionLogEntry;
import com.storyforge.orchestrator.model.ExecutionStatus;
import com.storyforge.orchestrator.model.NodeResultRecord;
import com.storyforge.orchestrator.model.WorkflowExecution;
import com.storyforge.orchestrator.model.WorkflowStatus;
import com.storyforge.orchestrator.repository.NodeResultRepository;
import com.storyforge.orchestrator.repository.WorkflowExecutionRepository;
import com.storyforge.orchestrator.repository.WorkflowRepository;
import com.storyforge.orchestrator.workflow.NodeResult;
import com.storyforge.orchestrator.workflow.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Worker-side writes for a workflow execution.
 *
 * Each method is its own transaction, so a node's result is durable as soon
 * as the node finishes and a later crash or pause loses at most the node in
 * flight.
 */
@Service
public class WorkflowExecutionRecorder {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionRecorder.class);

    private final WorkflowRepository          workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final NodeResultRepository        nodeResultRepository;

    public WorkflowExecutionRecorder(WorkflowRepository workflowRepository,
                                     WorkflowExecutionRepository executionRepository,
                                     NodeResultRepository nodeResultRepository) {
        this.workflowRepository   = workflowRepository;
        this.executionRepository  = executionRepository;
        this.nodeResultRepository = nodeResultRepository;
    }

    /** What a worker needs to run an execution. */
    public record RunContext(UUID workflowId, String graphJson, Map<String, NodeResult> prior) {}

    /**
     * Mark the execution RUNNING and load the node results it was seeded with.
     *
     * @return empty if the execution is gone, already finished, owned by
     *         another job, or its workflow was paused before the job started
     */
    @Transactional
    public Optional<RunContext> start(WorkflowJob job) {
        WorkflowExecution execution = executionRepository.findById(job.executionId()).orElse(null);
        if (execution == null || execution.getStatus().isTerminal()
                || !Objects.equals(execution.getJobHandle(), job.handle())) {
            log.warn("Skipping stale workflow job {} for execution {}", job.handle(), job.executionId());
            return Optional.empty();
        }
        if (execution.getWorkflow().getStatus() != WorkflowStatus.RUNNING) {
            execution.setStatus(ExecutionStatus.CANCELLED);
            execution.setCompletedAt(Instant.now());
            execution.appendLog(ExecutionLogEntry.info(null, "Workflow was paused before the run started"));
            return Optional.empty();
        }

        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setStartedAt(Instant.now());
        execution.appendLog(ExecutionLogEntry.info(null, "Execution started"));

        Map<String, NodeResult> prior = new LinkedHashMap<>();
        for (NodeResultRecord r : nodeResultRepository.findByExecutionIdOrderByRecordedAtAsc(execution.getId())) {
            if (NodeStatus.COMPLETED.name().equals(r.getStatus())) {
                prior.put(r.getNodeId(), new NodeResult(NodeStatus.COMPLETED,
                        NodeResult.outputsFromMap(r.getOutputs()), null, r.getRecordedAt()));
            }
        }
        return Optional.of(new RunContext(execution.getWorkflow().getId(),
                execution.getWorkflow().getGraphJson(), prior));
    }

    @Transactional
    public void nodeStarted(UUID executionId, UUID workflowId, String nodeId) {
        executionRepository.findById(executionId).ifPresent(e ->
                e.appendLog(ExecutionLogEntry.info(nodeId, "Executing node " + nodeId)));
        workflowRepository.markCurrentNode(workflowId, nodeId, Instant.now());
    }

    /** Persist a node outcome, replacing an earlier result of the same node in this execution. */
    @Transactional
    public void nodeFinished(UUID executionId, String nodeId, NodeResult result) {
        Map<String, Object> outputs = result.outputsAsMap();
        String status = result.status().name();
        Optional<NodeResultRecord> existing = nodeResultRepository.findByExecutionIdAndNodeId(executionId, nodeId);
        if (existing.isPresent()) {
            existing.get().replace(status, outputs, result.error(), result.timestamp());
        } else {
            nodeResultRepository.save(new NodeResultRecord(executionId, nodeId, status,
                    outputs, result.error(), result.timestamp()));
        }
        executionRepository.findById(executionId).ifPresent(e -> e.appendLog(
                result.status() == NodeStatus.COMPLETED
                        ? ExecutionLogEntry.info(nodeId, "Node " + nodeId + " completed")
                        : ExecutionLogEntry.error(nodeId, "Node " + nodeId + " failed: " + result.error())));
    }

    /**
     * Close the execution. The workflow status follows only if this is still
     * the workflow's latest execution and the workflow is still RUNNING, so a
     * superseded or paused run never changes it.
     */
    @Transactional
    public void finish(UUID executionId, ExecutionStatus status, String error) {
        WorkflowExecution execution = executionRepository.findById(executionId).orElse(null);
        if (execution == null) {
            return;
        }
        close(execution, status, error);
    }

    /**
     * Fail an execution whose job will never run or died outside the engine.
     * Runs in its own transaction since the dispatcher may call it after the
     * submitting transaction committed.
     *
     * @return false if the execution is gone or already finished
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean abandon(UUID executionId, String reason) {
        WorkflowExecution execution = executionRepository.findById(executionId).orElse(null);
        if (execution == null || execution.getStatus().isTerminal()) {
            return false;
        }
        log.error("Workflow execution {} abandoned: {}", executionId, reason);
        close(execution, ExecutionStatus.FAILED, reason);
        return true;
    }

    private void close(WorkflowExecution execution, ExecutionStatus status, String error) {
        UUID executionId = execution.getId();
        execution.setStatus(status);
        execution.setCompletedAt(Instant.now());
        execution.setErrorMessage(error);
        execution.appendLog(error == null
                ? ExecutionLogEntry.info(null, "Execution " + status.value())
                : ExecutionLogEntry.error(null, "Execution " + status.value() + ": " + error));
        executionRepository.flush();

        WorkflowStatus next = switch (status) {
            case COMPLETED -> WorkflowStatus.COMPLETED;
            case FAILED    -> WorkflowStatus.FAILED;
            default        -> null;
        };
        UUID workflowId = execution.getWorkflow().getId();
        boolean latest = executionRepository.findFirstByWorkflowIdOrderByCreatedAtDesc(workflowId)
                .map(e -> e.getId().equals(executionId))
                .orElse(false);
        if (next != null && latest) {
            workflowRepository.transition(workflowId, EnumSet.of(WorkflowStatus.RUNNING), next, Instant.now());
        }
    }
}
