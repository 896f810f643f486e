package com.storyforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** One line of a workflow execution log. */
public record ExecutionLogEntry(
        Instant timestamp,
        @JsonProperty("node_id") String nodeId,
        String  level,
        String  message
) {
    public static ExecutionLogEntry info(String nodeId, String message) {
        return new ExecutionLogEntry(Instant.now(), nodeId, "info", message);
    }

    public static ExecutionLogEntry error(String nodeId, String message) {
        return new ExecutionLogEntry(Instant.now(), nodeId, "error", message);
    }
}
