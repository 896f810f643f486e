package com.storyforge.orchestrator.workflow;

/**
 * Called by the engine when a node starts (result is null), completes or fails.
 */
@FunctionalInterface
public interface NodeProgressListener {

    NodeProgressListener NONE = (nodeId, status, result) -> {};

    void onNode(String nodeId, NodeStatus status, NodeResult result);
}
