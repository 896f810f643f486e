package com.storyforge.orchestrator.error;

import java.util.UUID;

public class NotFoundException extends OrchestratorException {

    public NotFoundException(ErrorCode code, String message) {
        super(code, message);
    }

    public static NotFoundException project(UUID projectId) {
        return new NotFoundException(ErrorCode.PROJECT_NOT_FOUND, "Project not found: " + projectId);
    }

    public static NotFoundException stage(UUID projectId, String stage) {
        return new NotFoundException(ErrorCode.STAGE_NOT_FOUND,
                "Stage '" + stage + "' not found for project " + projectId);
    }

    public static NotFoundException template(UUID templateId) {
        return new NotFoundException(ErrorCode.TEMPLATE_NOT_FOUND, "Workflow template not found: " + templateId);
    }
}
