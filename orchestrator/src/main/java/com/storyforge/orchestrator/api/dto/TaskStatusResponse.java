package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record TaskStatusResponse(
        @JsonProperty("task_id")    String taskId,
        String state,
        @JsonProperty("project_id") UUID   projectId
) {}
