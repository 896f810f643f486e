package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.model.ExecutionLogEntry;
import com.storyforge.orchestrator.model.WorkflowExecution;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** One entry of the execution history, with only the tail of its log. */
public record ExecutionResponse(
        UUID    id,
        String  status,
        @JsonProperty("created_at")    Instant                 createdAt,
        @JsonProperty("started_at")    Instant                 startedAt,
        @JsonProperty("completed_at")  Instant                 completedAt,
        @JsonProperty("error_message") String                  errorMessage,
        @JsonProperty("resumed_from")  UUID                    resumedFrom,
        List<ExecutionLogEntry> logs
) {
    public static final int LOG_TAIL = 10;

    public static ExecutionResponse from(WorkflowExecution e) {
        return new ExecutionResponse(
                e.getId(),
                e.getStatus().value(),
                e.getCreatedAt(),
                e.getStartedAt(),
                e.getCompletedAt(),
                e.getErrorMessage(),
                e.getResumedFrom(),
                List.copyOf(e.tailLogs(LOG_TAIL))
        );
    }
}
