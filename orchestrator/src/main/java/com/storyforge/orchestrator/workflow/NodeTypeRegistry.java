package com.storyforge.orchestrator.workflow;

import com.storyforge.orchestrator.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of node types available to workflows.
 *
 * Spring collects every {@link NodeDefinition} bean and passes the list here;
 * the map is frozen at construction and only read afterwards, so it is safe
 * to share across worker threads. Adding a node type only requires declaring
 * a new {@code @Component}.
 */
@Component
public class NodeTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeTypeRegistry.class);

    private final Map<String, NodeDefinition> definitions;

    public NodeTypeRegistry(List<NodeDefinition> all) {
        Map<String, NodeDefinition> map = new HashMap<>();
        for (NodeDefinition def : all) {
            if (map.putIfAbsent(def.type(), def) != null) {
                throw new IllegalStateException("Duplicate node type: " + def.type());
            }
            log.info("Registered node type '{}' [{}]", def.type(), def.category());
        }
        this.definitions = Map.copyOf(map);
    }

    /**
     * @throws ValidationException if no such type is registered
     */
    public NodeDefinition get(String type) {
        NodeDefinition def = definitions.get(type);
        if (def == null) {
            throw new ValidationException("Unknown node type: " + type);
        }
        return def;
    }

    public boolean contains(String type) {
        return definitions.containsKey(type);
    }

    /** All definitions, grouped by category then type. */
    public List<NodeDefinition> definitions() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(NodeDefinition::category).thenComparing(NodeDefinition::type))
                .toList();
    }
}
