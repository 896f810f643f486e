package com.storyforge.orchestrator.workflow;

import com.storyforge.orchestrator.error.JobExecutionException;

/** A workflow node failed; the run stops at this node. */
public class NodeExecutionException extends JobExecutionException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, Category category, String message, Throwable cause) {
        super(category, "Node " + nodeId + " failed: " + message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() { return nodeId; }
}
