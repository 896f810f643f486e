package com.storyforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyforge.orchestrator.service.WorkflowService.Validation;

import java.util.List;

/** Either {valid, execution_order, node_count, edge_count} or {valid=false, error}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResponse(
        boolean valid,
        @JsonProperty("execution_order") List<String> executionOrder,
        String  error,
        @JsonProperty("node_count")      Integer      nodeCount,
        @JsonProperty("edge_count")      Integer      edgeCount
) {
    public static ValidationResponse from(Validation v) {
        if (!v.valid()) {
            return new ValidationResponse(false, null, v.error(), null, null);
        }
        return new ValidationResponse(true, v.executionOrder(), null, v.nodeCount(), v.edgeCount());
    }
}
