package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.service.PipelineService.Dispatch;
import com.storyforge.orchestrator.service.PipelineService.ResumeResult;

import java.time.Instant;

/**
 * Response body for POST /projects/{id}/resume. Which fields are present
 * depends on the outcome: a new dispatch, an already-running stage, or a
 * project with nothing left to run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResumeResponse(
        String message,
        ProjectResponse project,
        @JsonProperty("task_id")               String  taskId,
        String channel,
        @JsonProperty("current_stage")         String  currentStage,
        @JsonProperty("current_stage_display") String  currentStageDisplay,
        @JsonProperty("resumed_at")            Instant resumedAt,
        @JsonProperty("already_running")       Boolean alreadyRunning,
        @JsonProperty("all_stages_completed")  Boolean allStagesCompleted
) {
    public static ResumeResponse from(ResumeResult result) {
        ProjectResponse project = ProjectResponse.from(result.project());
        if (result.allStagesCompleted()) {
            return new ResumeResponse("All stages completed", project,
                    null, null, null, null, null, null, true);
        }
        Dispatch d = result.dispatch();
        if (result.alreadyRunning()) {
            return new ResumeResponse("Stage is already running", project,
                    d.jobHandle(), d.channel(), d.stage().value(), d.stage().displayName(),
                    null, true, null);
        }
        return new ResumeResponse("Project resumed", project,
                d.jobHandle(), d.channel(), d.stage().value(), d.stage().displayName(),
                result.resumedAt(), null, null);
    }
}
