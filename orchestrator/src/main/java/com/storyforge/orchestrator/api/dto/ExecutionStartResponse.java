package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.service.WorkflowService.ExecutionStart;

import java.util.UUID;

public record ExecutionStartResponse(
        String message,
        @JsonProperty("execution_id") UUID   executionId,
        @JsonProperty("task_id")      String taskId,
        String channel
) {
    public static ExecutionStartResponse from(ExecutionStart start, String message) {
        return new ExecutionStartResponse(message, start.executionId(), start.jobHandle(), start.channel());
    }
}
