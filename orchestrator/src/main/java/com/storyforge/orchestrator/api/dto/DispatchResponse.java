package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.service.PipelineService.Dispatch;

import java.util.UUID;

/**
 * Response body for execute-stage and retry-stage: where to poll
 * (task_id) and where to listen (channel).
 */
public record DispatchResponse(
        @JsonProperty("task_id")    String taskId,
        String channel,
        String stage,
        String message,
        @JsonProperty("project_id") UUID   projectId
) {
    public static DispatchResponse from(Dispatch dispatch, String message) {
        return new DispatchResponse(
                dispatch.jobHandle(),
                dispatch.channel(),
                dispatch.stage().value(),
                message,
                dispatch.projectId()
        );
    }
}
