package com.storyforge.orchestrator.api.dto;

import com.storyforge.orchestrator.workflow.NodeDefinition;

import java.util.List;

public record NodeTypeResponse(String type, String name, String category,
                               List<String> inputs, List<String> outputs) {

    public static NodeTypeResponse from(NodeDefinition def) {
        return new NodeTypeResponse(def.type(), def.displayName(), def.category(),
                def.inputPorts(), def.outputPorts());
    }
}
