package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request body for retry-stage and rollback-stage. */
public record StageRequest(@JsonProperty("stage_name") String stageName) {}
