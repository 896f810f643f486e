package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.model.WorkflowTemplate;

import java.time.Instant;
import java.util.UUID;

/** One entry of the template list; the graph itself is only read when applied. */
public record TemplateResponse(
        UUID    id,
        String  name,
        String  description,
        @JsonProperty("preview_image") String  previewImage,
        @JsonProperty("usage_count")   int     usageCount,
        @JsonProperty("is_public")     boolean isPublic,
        @JsonProperty("created_by")    String  createdBy,
        @JsonProperty("created_at")    Instant createdAt
) {
    public static TemplateResponse from(WorkflowTemplate t) {
        return new TemplateResponse(t.getId(), t.getName(), t.getDescription(), t.getPreviewImage(),
                t.getUsageCount(), t.isPublic(), t.getCreatedBy(), t.getCreatedAt());
    }
}
