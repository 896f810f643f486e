package com.storyforge.orchestrator.workflow;

/**
 * A connection from a producer's output port to a consumer's input port.
 * Ports default to {@code output} and {@code input}.
 */
public record EdgeSpec(String source, String target, String sourcePort, String targetPort) {

    public static final String DEFAULT_SOURCE_PORT = "output";
    public static final String DEFAULT_TARGET_PORT = "input";

    public EdgeSpec {
        if (sourcePort == null || sourcePort.isBlank()) sourcePort = DEFAULT_SOURCE_PORT;
        if (targetPort == null || targetPort.isBlank()) targetPort = DEFAULT_TARGET_PORT;
    }
}
