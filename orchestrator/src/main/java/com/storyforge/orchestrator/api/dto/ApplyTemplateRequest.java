package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/** Request body for POST /projects/{id}/workflow/apply-template. */
public record ApplyTemplateRequest(@JsonProperty("template_id") UUID templateId) {}
