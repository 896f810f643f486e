package com.storyforge.orchestrator.error;

import java.util.Set;

/**
 * Raised by the topological sort when the graph has at least one cycle.
 * Carries the ids of the nodes that could not be ordered.
 */
public class CycleException extends OrchestratorException {

    private final Set<String> unresolved;

    public CycleException(Set<String> unresolved) {
        super(ErrorCode.DATA_VALIDATION_FAILED, "Workflow contains a cycle through nodes " + unresolved);
        this.unresolved = Set.copyOf(unresolved);
    }

    public Set<String> getUnresolved() { return unresolved; }
}
