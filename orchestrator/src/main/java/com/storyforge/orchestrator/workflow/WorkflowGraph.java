package com.storyforge.orchestrator.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of the editor's {@code {nodes, edges}} document.
 *
 * Node config is read from {@code data.config} (editor layout) or a top-level
 * {@code config}. Edge ports are read from {@code sourceHandle}/{@code targetHandle}
 * or {@code sourcePort}/{@code targetPort}.
 */
public record WorkflowGraph(List<NodeSpec> nodes, List<EdgeSpec> edges) {

    public WorkflowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static WorkflowGraph parse(String graphJson, ObjectMapper json) {
        try {
            return parse(json.readTree(graphJson), json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Workflow graph is not valid JSON: " + e.getOriginalMessage());
        }
    }

    public static WorkflowGraph parse(JsonNode root, ObjectMapper json) {
        if (root == null || !root.isObject()) {
            throw new ValidationException("Workflow graph must be an object with nodes and edges");
        }
        List<NodeSpec> nodes = new ArrayList<>();
        for (JsonNode n : root.path("nodes")) {
            String id   = text(n, "id");
            String type = text(n, "type");
            if (id == null || type == null) {
                throw new ValidationException("Every node needs an id and a type: " + n);
            }
            JsonNode config = n.path("data").path("config");
            if (config.isMissingNode()) {
                config = n.path("config");
            }
            Map<String, Object> cfg = config.isObject()
                    ? json.convertValue(config, new TypeReference<Map<String, Object>>() {})
                    : Map.of();
            nodes.add(new NodeSpec(id, type, cfg));
        }
        List<EdgeSpec> edges = new ArrayList<>();
        for (JsonNode e : root.path("edges")) {
            String source = text(e, "source");
            String target = text(e, "target");
            if (source == null || target == null) {
                throw new ValidationException("Every edge needs a source and a target: " + e);
            }
            String sourcePort = text(e, "sourceHandle");
            String targetPort = text(e, "targetHandle");
            if (sourcePort == null) sourcePort = text(e, "sourcePort");
            if (targetPort == null) targetPort = text(e, "targetPort");
            edges.add(new EdgeSpec(source, target, sourcePort, targetPort));
        }
        return new WorkflowGraph(nodes, edges);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
