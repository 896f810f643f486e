package com.storyforge.orchestrator.workflow;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Recorded outcome of one node: status, outputs (empty on failure), error and time. */
public record NodeResult(NodeStatus status, Map<String, PortValue> outputs, String error, Instant timestamp) {

    public NodeResult {
        outputs = outputs == null ? Map.of() : Map.copyOf(outputs);
    }

    public static NodeResult completed(Map<String, PortValue> outputs) {
        return new NodeResult(NodeStatus.COMPLETED, outputs, null, Instant.now());
    }

    public static NodeResult failed(String error) {
        return new NodeResult(NodeStatus.FAILED, Map.of(), error, Instant.now());
    }

    /** Outputs as plain maps, for JSON columns and event payloads. */
    public Map<String, Object> outputsAsMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        outputs.forEach((port, value) -> map.put(port, value.toMap()));
        return map;
    }

    /** Rebuild outputs stored by {@link #outputsAsMap()}. */
    public static Map<String, PortValue> outputsFromMap(Map<String, Object> stored) {
        Map<String, PortValue> outputs = new LinkedHashMap<>();
        if (stored != null) {
            stored.forEach((port, value) -> {
                if (value instanceof Map<?, ?> m) {
                    outputs.put(port, PortValue.fromMap(m));
                }
            });
        }
        return outputs;
    }
}
