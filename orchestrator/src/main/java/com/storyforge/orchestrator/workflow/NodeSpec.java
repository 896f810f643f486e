package com.storyforge.orchestrator.workflow;

import java.util.Map;

/** One node of a saved graph: its id, its registered type and its static configuration. */
public record NodeSpec(String id, String type, Map<String, Object> config) {

    public NodeSpec {
        config = config == null ? Map.of() : config;
    }
}
