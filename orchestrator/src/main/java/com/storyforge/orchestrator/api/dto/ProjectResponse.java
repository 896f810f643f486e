package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.model.Project;

import java.time.Instant;
import java.util.UUID;

public record ProjectResponse(
        UUID    id,
        String  name,
        @JsonProperty("owner_id")     String  ownerId,
        String  status,
        @JsonProperty("created_at")   Instant createdAt,
        @JsonProperty("updated_at")   Instant updatedAt,
        @JsonProperty("completed_at") Instant completedAt
) {
    public static ProjectResponse from(Project project) {
        return new ProjectResponse(
                project.getId(),
                project.getName(),
                project.getOwnerId(),
                project.getStatus().value(),
                project.getCreatedAt(),
                project.getUpdatedAt(),
                project.getCompletedAt()
        );
    }
}
