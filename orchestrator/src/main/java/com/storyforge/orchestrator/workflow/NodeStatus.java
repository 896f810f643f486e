package com.storyforge.orchestrator.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
