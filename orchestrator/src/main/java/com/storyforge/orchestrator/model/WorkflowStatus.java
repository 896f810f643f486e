package com.storyforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkflowStatus {
    DRAFT,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
