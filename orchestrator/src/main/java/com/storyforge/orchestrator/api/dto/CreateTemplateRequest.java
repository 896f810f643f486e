package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.storyforge.orchestrator.service.WorkflowService.NewTemplate;

/**
 * Request body for POST /workflows/templates.
 *
 * created_by is optional; unattributed templates belong to "anonymous".
 */
public record CreateTemplateRequest(
        String name,
        String description,
        @JsonProperty("workflow_data") JsonNode workflowData,
        @JsonProperty("preview_image") String   previewImage,
        @JsonProperty("is_public")     boolean  isPublic,
        @JsonProperty("created_by")    String   createdBy
) {
    public NewTemplate toNewTemplate() {
        String owner = createdBy == null || createdBy.isBlank() ? "anonymous" : createdBy;
        return new NewTemplate(name, description, workflowData, previewImage, owner, isPublic);
    }
}
