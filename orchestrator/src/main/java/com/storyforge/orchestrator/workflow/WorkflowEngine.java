package com.storyforge.orchestrator.workflow;

import com.storyforge.orchestrator.dispatch.CancellationToken;
import com.storyforge.orchestrator.dispatch.JobCancelledException;
import com.storyforge.orchestrator.error.CycleException;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Executes one workflow graph.
 *
 * Not a Spring bean: one engine per run, used by a single worker thread.
 * Nodes run strictly one at a time in topological order, so logs and
 * results come out in a deterministic order.
 *
 * Usage:
 * <pre>
 *   WorkflowEngine engine = new WorkflowEngine(registry);
 *   engine.load(graph);                       // unknown types fail here
 *   engine.execute(listener, token);          // or resumeFrom(nodeId, prior, ...)
 * </pre>
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final NodeTypeRegistry registry;

    // Insertion order = graph order; keeps the sort deterministic.
    private final Map<String, WorkflowNode>   nodes         = new LinkedHashMap<>();
    private final Map<String, String>         nodeTypes     = new HashMap<>();
    private final Map<String, List<EdgeSpec>> edgesByTarget = new HashMap<>();
    private final List<EdgeSpec>              edges         = new ArrayList<>();
    private final Map<String, NodeResult>     results       = new LinkedHashMap<>();

    public WorkflowEngine(NodeTypeRegistry registry) {
        this.registry = registry;
    }

    // ------------------------------------------------------------------
    // Load
    // ------------------------------------------------------------------

    /**
     * Instantiate every node through the registry and index edges by target.
     *
     * @throws ValidationException on an unknown node type, a duplicate node id,
     *                             or an edge naming a node that does not exist
     */
    public void load(WorkflowGraph graph) {
        nodes.clear();
        nodeTypes.clear();
        edges.clear();
        edgesByTarget.clear();
        results.clear();

        for (NodeSpec spec : graph.nodes()) {
            if (nodes.containsKey(spec.id())) {
                throw new ValidationException("Duplicate node id: " + spec.id());
            }
            NodeDefinition def = registry.get(spec.type());
            nodes.put(spec.id(), def.create(spec.config()));
            nodeTypes.put(spec.id(), spec.type());
        }
        for (EdgeSpec edge : graph.edges()) {
            if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                throw new ValidationException("Edge " + edge.source() + " -> " + edge.target()
                        + " references a node that is not in the graph");
            }
            edges.add(edge);
            edgesByTarget.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        log.debug("Loaded workflow with {} nodes and {} edges", nodes.size(), edges.size());
    }

    public int nodeCount() { return nodes.size(); }
    public int edgeCount() { return edges.size(); }

    // ------------------------------------------------------------------
    // Topological sort
    // ------------------------------------------------------------------

    /**
     * Kahn's algorithm with a FIFO queue seeded in graph order.
     *
     * @throws CycleException if not every node can be ordered; no partial order is returned
     */
    public List<String> topologicalSort() {
        Map<String, Integer>      inDegree  = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new HashMap<>();
        for (String id : nodes.keySet()) {
            inDegree.put(id, 0);
            adjacency.put(id, new ArrayList<>());
        }
        for (EdgeSpec edge : edges) {
            adjacency.get(edge.source()).add(edge.target());
            inDegree.merge(edge.target(), 1, Integer::sum);
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });

        List<String> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (String next : adjacency.get(id)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }

        if (order.size() != nodes.size()) {
            Set<String> unresolved = new LinkedHashSet<>(nodes.keySet());
            order.forEach(unresolved::remove);
            throw new CycleException(unresolved);
        }
        return Collections.unmodifiableList(order);
    }

    // ------------------------------------------------------------------
    // Execute
    // ------------------------------------------------------------------

    /**
     * Run every node in topological order.
     *
     * @return results by node id, in execution order
     * @throws NodeExecutionException on the first failing node; nothing after it runs
     * @throws JobCancelledException  if the token is cancelled between nodes
     */
    public Map<String, NodeResult> execute(NodeProgressListener listener, CancellationToken token) {
        results.clear();
        runAll(topologicalSort(), listener, token);
        return Collections.unmodifiableMap(results);
    }

    /**
     * Run only the part of the topological order after {@code nodeId}, feeding
     * {@code prior} results to nodes that depend on already-completed work.
     * Nodes up to and including {@code nodeId} are not run again.
     *
     * @throws ValidationException if {@code nodeId} is not in the graph
     */
    public Map<String, NodeResult> resumeFrom(String nodeId,
                                              Map<String, NodeResult> prior,
                                              NodeProgressListener listener,
                                              CancellationToken token) {
        List<String> order = topologicalSort();
        int idx = order.indexOf(nodeId);
        if (idx < 0) {
            throw new ValidationException("Cannot resume from unknown node: " + nodeId);
        }
        results.clear();
        prior.forEach((id, result) -> {
            if (nodes.containsKey(id)) results.put(id, result);
        });
        List<String> suffix = order.subList(idx + 1, order.size());
        log.info("Resuming after node {}: {} of {} nodes left", nodeId, suffix.size(), order.size());
        runAll(suffix, listener, token);
        return Collections.unmodifiableMap(results);
    }

    /**
     * Last node of the longest prefix of the topological order whose nodes all
     * completed in {@code prior}, or null if the first node has not completed.
     * This is where a resumed run picks up.
     */
    public String resumePoint(Map<String, NodeResult> prior) {
        String last = null;
        for (String id : topologicalSort()) {
            NodeResult r = prior.get(id);
            if (r == null || r.status() != NodeStatus.COMPLETED) {
                break;
            }
            last = id;
        }
        return last;
    }

    public Map<String, NodeResult> results() {
        return Collections.unmodifiableMap(results);
    }

    private void runAll(List<String> order, NodeProgressListener listener, CancellationToken token) {
        int total = order.size();
        for (int i = 0; i < total; i++) {
            token.checkpoint();
            String id = order.get(i);
            log.info("Executing node {}/{}: {} ({})", i + 1, total, id, nodeTypes.get(id));
            listener.onNode(id, NodeStatus.RUNNING, null);

            Map<String, PortValue> inputs = resolveInputs(id);
            try {
                Map<String, PortValue> outputs = nodes.get(id).execute(inputs);
                NodeResult result = NodeResult.completed(outputs);
                results.put(id, result);
                listener.onNode(id, NodeStatus.COMPLETED, result);
            } catch (JobCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                Category category = e instanceof JobExecutionException je ? je.getCategory() : Category.INTERNAL;
                String message = e.getMessage() == null ? e.toString() : e.getMessage();
                NodeResult failed = NodeResult.failed(message);
                results.put(id, failed);
                log.error("Node {} failed: {}", id, message);
                listener.onNode(id, NodeStatus.FAILED, failed);
                throw new NodeExecutionException(id, category, message, e);
            }
        }
    }

    /** Values for each input port, taken from upstream outputs by the edges' port mapping. */
    private Map<String, PortValue> resolveInputs(String nodeId) {
        Map<String, PortValue> inputs = new LinkedHashMap<>();
        for (EdgeSpec edge : edgesByTarget.getOrDefault(nodeId, List.of())) {
            NodeResult upstream = results.get(edge.source());
            if (upstream == null || upstream.status() != NodeStatus.COMPLETED) {
                continue;
            }
            PortValue value = upstream.outputs().get(edge.sourcePort());
            if (value != null) {
                inputs.put(edge.targetPort(), value);
            } else {
                log.debug("Node {} has no output port '{}' for {}", edge.source(), edge.sourcePort(), nodeId);
            }
        }
        return inputs;
    }
}
