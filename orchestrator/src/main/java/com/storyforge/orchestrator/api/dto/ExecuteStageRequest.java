package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for POST /projects/{id}/execute-stage.
 *
 * use_streaming=true answers with the stage's SSE feed instead of JSON.
 */
public record ExecuteStageRequest(
        @JsonProperty("stage_name")    String              stageName,
        @JsonProperty("input_data")    Map<String, Object> inputData,
        @JsonProperty("use_streaming") boolean             useStreaming
) {}
