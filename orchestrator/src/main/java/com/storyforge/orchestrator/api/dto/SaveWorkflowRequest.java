package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/** Request body for POST /projects/{id}/workflow: the editor's {nodes, edges} document. */
public record SaveWorkflowRequest(@JsonProperty("workflow_data") JsonNode workflowData) {}
