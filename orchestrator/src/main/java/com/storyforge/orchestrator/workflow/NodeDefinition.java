package com.storyforge.orchestrator.workflow;

import java.util.List;
import java.util.Map;

/**
 * A registered node type. Every implementation declared as a Spring bean is
 * picked up by {@link NodeTypeRegistry} at startup.
 */
public interface NodeDefinition {

    /** Type key used in saved graphs, e.g. {@code ai_image}. */
    String type();

    String displayName();

    /** Palette group: input, ai, processing. */
    String category();

    List<String> inputPorts();

    List<String> outputPorts();

    /** Build an instance for one graph node. */
    WorkflowNode create(Map<String, Object> config);
}
