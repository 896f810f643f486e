package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyforge.orchestrator.error.ValidationException;
import com.storyforge.orchestrator.model.Workflow;
import com.storyforge.orchestrator.model.WorkflowStatus;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowResponse(
        @JsonProperty("workflow_id")     UUID     workflowId,
        @JsonProperty("workflow_data")   JsonNode workflowData,
        String status,
        @JsonProperty("current_node_id") String   currentNodeId
) {
    public static WorkflowResponse from(Workflow workflow, ObjectMapper json) {
        JsonNode data;
        try {
            data = json.readTree(workflow.getGraphJson());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Stored workflow graph is not valid JSON");
        }
        return new WorkflowResponse(workflow.getId(), data, workflow.getStatus().value(), workflow.getCurrentNodeId());
    }

    /** A project without a saved graph reads as an empty draft. */
    public static WorkflowResponse empty(ObjectMapper json) {
        ObjectNode data = json.createObjectNode();
        data.putArray("nodes");
        data.putArray("edges");
        return new WorkflowResponse(null, data, WorkflowStatus.DRAFT.value(), null);
    }
}
