package com.storyforge.orchestrator.api.dto;

public record RollbackResponse(String message, ProjectResponse project) {}
