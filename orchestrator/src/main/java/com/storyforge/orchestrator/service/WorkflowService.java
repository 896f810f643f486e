package com.storyforge.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.dispatch.TaskDispatcher;
import com.storyforge.orchestrator.error.ErrorCode;
import com.storyforge.orchestrator.error.NotFoundException;
import com.storyforge.orchestrator.error.OrchestratorException;
import com.storyforge.orchestrator.error.StateConflictException;
import com.storyforge.orchestrator.error.ValidationException;
import com.storyforge.orchestrator.model.NodeResultRecord;
import com.storyforge.orchestrator.model.Workflow;
import com.storyforge.orchestrator.model.WorkflowExecution;
import com.storyforge.orchestrator.model.WorkflowStatus;
import com.storyforge.orchestrator.model.WorkflowTemplate;
import com.storyforge.orchestrator.progress.ProgressChannels;
import com.storyforge.orchestrator.repository.NodeResultRepository;
import com.storyforge.orchestrator.repository.WorkflowExecutionRepository;
import com.storyforge.orchestrator.repository.WorkflowRepository;
import com.storyforge.orchestrator.repository.WorkflowTemplateRepository;
import com.storyforge.orchestrator.store.StageStateStore;
import com.storyforge.orchestrator.workflow.NodeDefinition;
import com.storyforge.orchestrator.workflow.NodeResult;
import com.storyforge.orchestrator.workflow.NodeStatus;
import com.storyforge.orchestrator.workflow.NodeTypeRegistry;
import com.storyforge.orchestrator.workflow.WorkflowEngine;
import com.storyforge.orchestrator.workflow.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Request-path control of a project's workflow graph.
 *
 * The graph is loaded and sorted synchronously before anything is
 * dispatched, so an unknown node type or a cycle is reported to the caller
 * instead of failing on a worker. Runs themselves are executed by
 * WorkflowRunner; progress goes out on the project's "workflow" channel.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    public static final String CHANNEL_STAGE = "workflow";

    private final StageStateStore             store;
    private final WorkflowRepository          workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final NodeResultRepository        nodeResultRepository;
    private final WorkflowTemplateRepository  templateRepository;
    private final NodeTypeRegistry            registry;
    private final TaskDispatcher              dispatcher;
    private final ObjectMapper                json;

    public WorkflowService(StageStateStore store,
                           WorkflowRepository workflowRepository,
                           WorkflowExecutionRepository executionRepository,
                           NodeResultRepository nodeResultRepository,
                           WorkflowTemplateRepository templateRepository,
                           NodeTypeRegistry registry,
                           TaskDispatcher dispatcher,
                           ObjectMapper json) {
        this.store                = store;
        this.workflowRepository   = workflowRepository;
        this.executionRepository  = executionRepository;
        this.nodeResultRepository = nodeResultRepository;
        this.templateRepository   = templateRepository;
        this.registry             = registry;
        this.dispatcher           = dispatcher;
        this.json                 = json;
    }

    // ------------------------------------------------------------------
    // Result types
    // ------------------------------------------------------------------

    public record ExecutionStart(UUID executionId, String jobHandle, String channel) {}

    public record NewTemplate(String name, String description, JsonNode graph,
                              String previewImage, String createdBy, boolean isPublic) {}

    public record Validation(boolean valid, List<String> executionOrder, String error,
                             int nodeCount, int edgeCount) {}

    // ------------------------------------------------------------------
    // Graph
    // ------------------------------------------------------------------

    /**
     * Create or replace the project's graph. Node types and edge endpoints are
     * checked here; cycles are left to validate() and execute().
     */
    @Transactional
    public Workflow saveGraph(UUID projectId, JsonNode graph) {
        requireProject(projectId);
        if (graph == null || graph.isNull() || graph.isMissingNode()) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "workflow_data is required");
        }
        newEngine(WorkflowGraph.parse(graph, json));

        Workflow saved = upsertGraph(projectId, graph.toString());
        log.info("Saved workflow {} for project {}", saved.getId(), projectId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Workflow> getGraph(UUID projectId) {
        requireProject(projectId);
        return workflowRepository.findByProjectId(projectId);
    }

    /** Parse, load and sort the saved graph without running anything. */
    @Transactional(readOnly = true)
    public Validation validate(UUID projectId) {
        Workflow workflow = requireWorkflow(projectId);
        try {
            WorkflowEngine engine = newEngine(WorkflowGraph.parse(workflow.getGraphJson(), json));
            return new Validation(true, engine.topologicalSort(), null, engine.nodeCount(), engine.edgeCount());
        } catch (OrchestratorException e) {
            return new Validation(false, null, e.getMessage(), 0, 0);
        }
    }

    public List<NodeDefinition> nodeTypes() {
        return registry.definitions();
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    /** Public templates plus those created by {@code ownerId}, newest first. */
    @Transactional(readOnly = true)
    public List<WorkflowTemplate> listTemplates(String ownerId) {
        return templateRepository.findVisibleTo(ownerId);
    }

    /** Save a graph as a template. It must load cleanly, cycles included. */
    @Transactional
    public WorkflowTemplate createTemplate(NewTemplate request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "name is required");
        }
        JsonNode graph = request.graph();
        if (graph == null || graph.isNull() || graph.isMissingNode()) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "workflow_data is required");
        }
        newEngine(WorkflowGraph.parse(graph, json)).topologicalSort();

        WorkflowTemplate saved = templateRepository.save(new WorkflowTemplate(request.name().strip(),
                request.description(), graph.toString(), request.previewImage(),
                request.createdBy(), request.isPublic()));
        log.info("Created {} workflow template {} '{}' for {}",
                saved.isPublic() ? "public" : "private", saved.getId(), saved.getName(), saved.getCreatedBy());
        return saved;
    }

    /**
     * Replace the project's graph with a copy of the template's and count the
     * use. Later edits to either side do not affect the other.
     */
    @Transactional
    public Workflow applyTemplate(UUID projectId, UUID templateId) {
        requireProject(projectId);
        if (templateId == null) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "template_id is required");
        }
        WorkflowTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> NotFoundException.template(templateId));

        Workflow workflow = upsertGraph(projectId, template.getGraphJson());
        workflow.setTemplateId(templateId);
        Workflow saved = workflowRepository.save(workflow);
        templateRepository.incrementUsage(templateId, Instant.now());
        log.info("Applied template {} to project {} (workflow {})", templateId, projectId, saved.getId());
        return saved;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /** Start a fresh run of the saved graph. */
    @Transactional
    public ExecutionStart execute(UUID projectId) {
        Workflow workflow = requireWorkflow(projectId);
        if (workflow.getStatus() == WorkflowStatus.RUNNING) {
            throw new StateConflictException(ErrorCode.PROJECT_INVALID_STATUS, "Workflow is already running");
        }
        newEngine(WorkflowGraph.parse(workflow.getGraphJson(), json)).topologicalSort();

        if (workflowRepository.transition(workflow.getId(),
                EnumSet.complementOf(EnumSet.of(WorkflowStatus.RUNNING)), WorkflowStatus.RUNNING, Instant.now()) == 0) {
            throw new StateConflictException(ErrorCode.PROJECT_INVALID_STATUS, "Workflow is already running");
        }
        // The transition cleared the persistence context; reattach by reference.
        WorkflowExecution execution = executionRepository.save(
                new WorkflowExecution(workflowRepository.getReferenceById(workflow.getId()), null));
        ExecutionStart start = dispatch(projectId, execution);
        log.info("Started workflow {} for project {}: execution {} as job {}",
                workflow.getId(), projectId, execution.getId(), start.jobHandle());
        return start;
    }

    /**
     * Stop the running workflow at its next node boundary. The node in flight
     * finishes and its result is kept for resume().
     *
     * @return the handle of the job asked to stop, if there was one
     */
    @Transactional
    public Optional<String> pause(UUID projectId) {
        Workflow workflow = requireWorkflow(projectId);
        if (workflowRepository.transition(workflow.getId(),
                EnumSet.of(WorkflowStatus.RUNNING), WorkflowStatus.PAUSED, Instant.now()) == 0) {
            throw new StateConflictException(ErrorCode.PROJECT_NOT_PAUSABLE, "Only a running workflow can be paused");
        }
        Optional<String> handle = executionRepository.findFirstByWorkflowIdOrderByCreatedAtDesc(workflow.getId())
                .filter(e -> !e.getStatus().isTerminal())
                .map(WorkflowExecution::getJobHandle);
        handle.ifPresent(dispatcher::cancel);
        log.info("Paused workflow {} for project {} (job {})", workflow.getId(), projectId, handle.orElse("none"));
        return handle;
    }

    /**
     * Continue a paused workflow in a new execution. The previous run's
     * completed prefix (in topological order) is copied into the new
     * execution and not run again.
     */
    @Transactional
    public ExecutionStart resume(UUID projectId) {
        Workflow workflow = requireWorkflow(projectId);
        if (workflow.getStatus() != WorkflowStatus.PAUSED) {
            throw new StateConflictException(ErrorCode.PROJECT_NOT_RESUMABLE,
                    "Workflow is " + workflow.getStatus().value() + ", not paused");
        }
        WorkflowEngine engine = newEngine(WorkflowGraph.parse(workflow.getGraphJson(), json));
        List<String> order = engine.topologicalSort();

        if (workflowRepository.transition(workflow.getId(),
                EnumSet.of(WorkflowStatus.PAUSED), WorkflowStatus.RUNNING, Instant.now()) == 0) {
            throw new StateConflictException(ErrorCode.PROJECT_NOT_RESUMABLE, "Workflow changed status concurrently");
        }

        Optional<WorkflowExecution> previous =
                executionRepository.findFirstByWorkflowIdOrderByCreatedAtDesc(workflow.getId());
        WorkflowExecution execution = executionRepository.save(
                new WorkflowExecution(workflowRepository.getReferenceById(workflow.getId()),
                        previous.map(WorkflowExecution::getId).orElse(null)));

        int seeded = 0;
        if (previous.isPresent()) {
            Map<String, NodeResultRecord> prior = new LinkedHashMap<>();
            Map<String, NodeResult> asResults = new LinkedHashMap<>();
            for (NodeResultRecord r : nodeResultRepository.findByExecutionIdOrderByRecordedAtAsc(previous.get().getId())) {
                if (NodeStatus.COMPLETED.name().equals(r.getStatus())) {
                    prior.put(r.getNodeId(), r);
                    asResults.put(r.getNodeId(), new NodeResult(NodeStatus.COMPLETED,
                            NodeResult.outputsFromMap(r.getOutputs()), null, r.getRecordedAt()));
                }
            }
            String resumePoint = engine.resumePoint(asResults);
            if (resumePoint != null) {
                for (String nodeId : order.subList(0, order.indexOf(resumePoint) + 1)) {
                    NodeResultRecord r = prior.get(nodeId);
                    nodeResultRepository.save(new NodeResultRecord(execution.getId(), nodeId, r.getStatus(),
                            r.getOutputs(), null, r.getRecordedAt()));
                    seeded++;
                }
            }
        }

        ExecutionStart start = dispatch(projectId, execution);
        log.info("Resumed workflow {} for project {}: execution {} with {}/{} nodes already done",
                workflow.getId(), projectId, execution.getId(), seeded, order.size());
        return start;
    }

    /** Latest executions first. */
    @Transactional(readOnly = true)
    public List<WorkflowExecution> history(UUID projectId) {
        requireProject(projectId);
        return workflowRepository.findByProjectId(projectId)
                .map(w -> executionRepository.findTop20ByWorkflowIdOrderByCreatedAtDesc(w.getId()))
                .orElse(List.of());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ExecutionStart dispatch(UUID projectId, WorkflowExecution execution) {
        String handle = dispatcher.submitWorkflow(projectId, execution.getId());
        execution.setJobHandle(handle);
        return new ExecutionStart(execution.getId(), handle, ProgressChannels.channel(projectId, CHANNEL_STAGE));
    }

    /** Create the project's workflow or overwrite its graph; refused while a run is in flight. */
    private Workflow upsertGraph(UUID projectId, String graphJson) {
        Workflow workflow = workflowRepository.findByProjectId(projectId).orElse(null);
        if (workflow == null) {
            return workflowRepository.save(new Workflow(projectId, graphJson));
        }
        if (workflow.getStatus() == WorkflowStatus.RUNNING) {
            throw new StateConflictException(ErrorCode.PROJECT_INVALID_STATUS,
                    "Workflow is running and cannot be changed");
        }
        workflow.setGraphJson(graphJson);
        return workflowRepository.save(workflow);
    }

    private WorkflowEngine newEngine(WorkflowGraph graph) {
        WorkflowEngine engine = new WorkflowEngine(registry);
        engine.load(graph);
        return engine;
    }

    private void requireProject(UUID projectId) {
        if (store.findProject(projectId).isEmpty()) {
            throw NotFoundException.project(projectId);
        }
    }

    private Workflow requireWorkflow(UUID projectId) {
        requireProject(projectId);
        return workflowRepository.findByProjectId(projectId)
                .orElseThrow(() -> new ValidationException(ErrorCode.DATA_MISSING_REQUIRED,
                        "Project " + projectId + " has no workflow"));
    }
}
