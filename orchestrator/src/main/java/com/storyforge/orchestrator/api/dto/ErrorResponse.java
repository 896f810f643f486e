package com.storyforge.orchestrator.api.dto;

/** Body of every error answer: a readable message and the numeric error code. */
public record ErrorResponse(String error, int code) {}
