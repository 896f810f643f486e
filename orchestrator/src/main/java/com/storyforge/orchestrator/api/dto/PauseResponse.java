package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.service.PipelineService.PauseResult;

import java.util.List;

/** Response body for POST /projects/{id}/pause. Cancellations are attempts, not confirmed stops. */
public record PauseResponse(
        String message,
        ProjectResponse project,
        @JsonProperty("cancelled_tasks") List<CancelledTask> cancelledTasks,
        @JsonProperty("cancelled_count") int                 cancelledCount
) {
    public record CancelledTask(String stage, @JsonProperty("task_id") String taskId) {}

    public static PauseResponse from(PauseResult result) {
        List<CancelledTask> tasks = result.cancelled().stream()
                .map(c -> new CancelledTask(c.stage().value(), c.jobHandle()))
                .toList();
        return new PauseResponse("Project paused", ProjectResponse.from(result.project()), tasks, tasks.size());
    }
}
