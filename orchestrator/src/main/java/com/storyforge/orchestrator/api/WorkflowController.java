package com.storyforge.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.api.dto.ApplyTemplateRequest;
import com.storyforge.orchestrator.api.dto.CreateTemplateRequest;
import com.storyforge.orchestrator.api.dto.ExecutionResponse;
import com.storyforge.orchestrator.api.dto.ExecutionStartResponse;
import com.storyforge.orchestrator.api.dto.NodeTypeResponse;
import com.storyforge.orchestrator.api.dto.SaveWorkflowRequest;
import com.storyforge.orchestrator.api.dto.TemplateResponse;
import com.storyforge.orchestrator.api.dto.ValidationResponse;
import com.storyforge.orchestrator.api.dto.WorkflowResponse;
import com.storyforge.orchestrator.model.Workflow;
import com.storyforge.orchestrator.model.WorkflowTemplate;
import com.storyforge.orchestrator.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for user-assembled workflow graphs.
 *
 * POST /projects/{id}/workflow             save the graph
 * GET  /projects/{id}/workflow             saved graph (an empty draft if none)
 * POST /projects/{id}/workflow/execute     start a run (202)
 * POST /projects/{id}/workflow/pause       stop at the next node boundary
 * POST /projects/{id}/workflow/resume      continue after the completed prefix
 * POST /projects/{id}/workflow/validate    check types, edges and cycles
 * GET  /projects/{id}/workflow/executions  latest runs with their log tails
 * POST /projects/{id}/workflow/apply-template  replace the graph with a template's
 * GET  /workflows/node-types               node library
 * GET  /workflows/templates                public templates plus the caller's own
 * POST /workflows/templates                save a graph as a template (201)
 */
@RestController
public class WorkflowController {

    private final WorkflowService workflows;
    private final ObjectMapper    json;

    public WorkflowController(WorkflowService workflows, ObjectMapper json) {
        this.workflows = workflows;
        this.json      = json;
    }

    @PostMapping("/projects/{id}/workflow")
    public WorkflowResponse save(@PathVariable UUID id, @RequestBody SaveWorkflowRequest req) {
        return WorkflowResponse.from(workflows.saveGraph(id, req.workflowData()), json);
    }

    @GetMapping("/projects/{id}/workflow")
    public WorkflowResponse get(@PathVariable UUID id) {
        return workflows.getGraph(id)
                .map(w -> WorkflowResponse.from(w, json))
                .orElseGet(() -> WorkflowResponse.empty(json));
    }

    @PostMapping("/projects/{id}/workflow/execute")
    public ResponseEntity<ExecutionStartResponse> execute(@PathVariable UUID id) {
        return ResponseEntity.accepted()
                .body(ExecutionStartResponse.from(workflows.execute(id), "Workflow started"));
    }

    @PostMapping("/projects/{id}/workflow/pause")
    public Map<String, Object> pause(@PathVariable UUID id) {
        Optional<String> cancelled = workflows.pause(id);
        return cancelled
                .<Map<String, Object>>map(h -> Map.of("message", "Workflow paused", "cancelled_task_id", h))
                .orElseGet(() -> Map.of("message", "Workflow paused"));
    }

    @PostMapping("/projects/{id}/workflow/resume")
    public ResponseEntity<ExecutionStartResponse> resume(@PathVariable UUID id) {
        return ResponseEntity.accepted()
                .body(ExecutionStartResponse.from(workflows.resume(id), "Workflow resumed"));
    }

    @PostMapping("/projects/{id}/workflow/validate")
    public ValidationResponse validate(@PathVariable UUID id) {
        return ValidationResponse.from(workflows.validate(id));
    }

    @GetMapping("/projects/{id}/workflow/executions")
    public List<ExecutionResponse> executions(@PathVariable UUID id) {
        return workflows.history(id).stream()
                .map(ExecutionResponse::from)
                .toList();
    }

    @GetMapping("/workflows/node-types")
    public List<NodeTypeResponse> nodeTypes() {
        return workflows.nodeTypes().stream()
                .map(NodeTypeResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    @GetMapping("/workflows/templates")
    public Map<String, List<TemplateResponse>> templates(
            @RequestParam(name = "owner_id", defaultValue = "anonymous") String ownerId) {
        return Map.of("templates", workflows.listTemplates(ownerId).stream()
                .map(TemplateResponse::from)
                .toList());
    }

    @PostMapping("/workflows/templates")
    public ResponseEntity<Map<String, Object>> createTemplate(@RequestBody CreateTemplateRequest req) {
        WorkflowTemplate template = workflows.createTemplate(req.toNewTemplate());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", "Template created", "template_id", template.getId()));
    }

    @PostMapping("/projects/{id}/workflow/apply-template")
    public Map<String, Object> applyTemplate(@PathVariable UUID id, @RequestBody ApplyTemplateRequest req) {
        Workflow workflow = workflows.applyTemplate(id, req.templateId());
        return Map.of("message", "Template applied", "workflow_id", workflow.getId());
    }
}
