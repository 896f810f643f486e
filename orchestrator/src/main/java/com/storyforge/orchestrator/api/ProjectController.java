package com.storyforge.orchestrator.api;

import com.storyforge.orchestrator.api.dto.CreateProjectRequest;
import com.storyforge.orchestrator.api.dto.DispatchResponse;
import com.storyforge.orchestrator.api.dto.ExecuteStageRequest;
import com.storyforge.orchestrator.api.dto.PauseResponse;
import com.storyforge.orchestrator.api.dto.ProjectDetailResponse;
import com.storyforge.orchestrator.api.dto.ProjectResponse;
import com.storyforge.orchestrator.api.dto.ResumeResponse;
import com.storyforge.orchestrator.api.dto.RollbackResponse;
import com.storyforge.orchestrator.api.dto.StageRequest;
import com.storyforge.orchestrator.api.dto.StageResponse;
import com.storyforge.orchestrator.api.dto.TaskStatusResponse;
import com.storyforge.orchestrator.error.ErrorCode;
import com.storyforge.orchestrator.error.ValidationException;
import com.storyforge.orchestrator.model.Project;
import com.storyforge.orchestrator.model.StageType;
import com.storyforge.orchestrator.progress.ProgressSubscription;
import com.storyforge.orchestrator.service.PipelineService;
import com.storyforge.orchestrator.service.PipelineService.Dispatch;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the content pipeline.
 *
 * POST /projects                       create a project with its five pending stages
 * GET  /projects/{id}                  project status
 * GET  /projects/{id}/stages           stages in pipeline order
 * POST /projects/{id}/execute-stage    dispatch one stage (202, or an SSE feed with use_streaming)
 * GET  /projects/{id}/task-status      state of a dispatched job
 * POST /projects/{id}/pause            pause and cancel running jobs
 * POST /projects/{id}/resume           continue from the earliest pending or failed stage
 * POST /projects/{id}/retry-stage      re-run a stage with its stored input
 * POST /projects/{id}/rollback-stage   reset a stage and everything after it
 *
 * Every call returns as soon as state is written; results arrive over SSE.
 */
@RestController
@RequestMapping("/projects")
public class ProjectController {

    private final PipelineService  pipeline;
    private final ProgressStreamer streamer;

    public ProjectController(PipelineService pipeline, ProgressStreamer streamer) {
        this.pipeline = pipeline;
        this.streamer = streamer;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/projects \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"Moonlit Harbor","ownerId":"u-42"}'
     */
    @PostMapping
    public ResponseEntity<ProjectDetailResponse> create(@RequestBody CreateProjectRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "name is required");
        }
        Project project = pipeline.createProject(req.name(), req.ownerId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ProjectDetailResponse.from(project, pipeline.listStages(project.getId())));
    }

    @GetMapping("/{id}")
    public ProjectResponse get(@PathVariable UUID id) {
        return ProjectResponse.from(pipeline.getProject(id));
    }

    @GetMapping("/{id}/stages")
    public List<StageResponse> stages(@PathVariable UUID id) {
        return pipeline.listStages(id).stream()
                .map(StageResponse::from)
                .toList();
    }

    /**
     * Dispatch one stage.
     *
     * Returns 202 with {task_id, channel} by default. With use_streaming the
     * response is the stage's SSE feed instead; it is subscribed before the
     * job is dispatched, so it sees the job's first event.
     *
     * Example:
     *   curl -X POST http://localhost:8080/projects/{id}/execute-stage \
     *     -H "Content-Type: application/json" \
     *     -d '{"stage_name":"rewrite","input_data":{"text":"Once upon a time..."}}'
     */
    @PostMapping("/{id}/execute-stage")
    public Object executeStage(@PathVariable UUID id, @RequestBody ExecuteStageRequest req) {
        if (req.stageName() == null || req.stageName().isBlank()) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "stage_name is required");
        }
        if (!req.useStreaming()) {
            Dispatch dispatch = pipeline.executeStage(id, req.stageName(), req.inputData());
            return ResponseEntity.accepted().body(DispatchResponse.from(dispatch,
                    dispatch.stage().displayName() + " started"));
        }

        String stage = StageType.fromName(req.stageName()).value();
        ProgressSubscription subscription = streamer.subscribe(id, stage);
        try {
            pipeline.executeStage(id, req.stageName(), req.inputData());
        } catch (RuntimeException e) {
            subscription.close();
            throw e;
        }
        return streamer.stream(subscription);
    }

    @GetMapping("/{id}/task-status")
    public TaskStatusResponse taskStatus(@PathVariable UUID id, @RequestParam("task_id") String taskId) {
        return new TaskStatusResponse(taskId, pipeline.taskStatus(id, taskId).apiState(), id);
    }

    @PostMapping("/{id}/pause")
    public PauseResponse pause(@PathVariable UUID id) {
        return PauseResponse.from(pipeline.pause(id));
    }

    @PostMapping("/{id}/resume")
    public ResumeResponse resume(@PathVariable UUID id) {
        return ResumeResponse.from(pipeline.resume(id));
    }

    @PostMapping("/{id}/retry-stage")
    public DispatchResponse retryStage(@PathVariable UUID id, @RequestBody StageRequest req) {
        Dispatch dispatch = pipeline.retryStage(id, requireStageName(req));
        return DispatchResponse.from(dispatch, dispatch.stage().displayName() + " retry started");
    }

    @PostMapping("/{id}/rollback-stage")
    public RollbackResponse rollbackStage(@PathVariable UUID id, @RequestBody StageRequest req) {
        String stageName = requireStageName(req);
        Project project = pipeline.rollbackStage(id, stageName);
        return new RollbackResponse("Rolled back to " + StageType.fromName(stageName).displayName(),
                ProjectResponse.from(project));
    }

    private static String requireStageName(StageRequest req) {
        if (req == null || req.stageName() == null || req.stageName().isBlank()) {
            throw new ValidationException(ErrorCode.DATA_MISSING_REQUIRED, "stage_name is required");
        }
        return req.stageName();
    }
}
