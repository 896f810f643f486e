package com.storyforge.orchestrator.workflow;

import java.util.Map;

/**
 * A loaded node instance. Receives the values delivered to its input ports
 * and returns values keyed by output port.
 *
 * Implementations throw {@code JobExecutionException} to fail the run.
 */
@FunctionalInterface
public interface WorkflowNode {

    Map<String, PortValue> execute(Map<String, PortValue> inputs);
}
