package com.storyforge.orchestrator.api.dto;

/**
 * Request body for POST /projects.
 *
 * ownerId is optional; unattributed projects belong to "anonymous".
 */
public record CreateProjectRequest(String name, String ownerId) {

    public CreateProjectRequest {
        if (ownerId == null || ownerId.isBlank()) ownerId = "anonymous";
    }
}
