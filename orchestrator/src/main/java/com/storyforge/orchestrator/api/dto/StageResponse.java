package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.model.Stage;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** One pipeline stage as listed by GET /projects/{id}/stages. */
public record StageResponse(
        UUID id,
        @JsonProperty("stage_type")    String              stageType,
        @JsonProperty("stage_display") String              stageDisplay,
        int    position,
        String status,
        @JsonProperty("retry_count")   int                 retryCount,
        @JsonProperty("max_retries")   int                 maxRetries,
        @JsonProperty("task_id")       String              taskId,
        @JsonProperty("error_message") String              errorMessage,
        @JsonProperty("input_data")    Map<String, Object> inputData,
        @JsonProperty("output_data")   Map<String, Object> outputData,
        @JsonProperty("started_at")    Instant             startedAt,
        @JsonProperty("completed_at")  Instant             completedAt
) {
    public static StageResponse from(Stage stage) {
        return new StageResponse(
                stage.getId(),
                stage.getStageType().value(),
                stage.getStageType().displayName(),
                stage.getPosition(),
                stage.getStatus().value(),
                stage.getRetryCount(),
                stage.getMaxRetries(),
                stage.getJobHandle(),
                stage.getErrorMessage(),
                stage.getInputData(),
                stage.getOutputData(),
                stage.getStartedAt(),
                stage.getCompletedAt()
        );
    }
}
