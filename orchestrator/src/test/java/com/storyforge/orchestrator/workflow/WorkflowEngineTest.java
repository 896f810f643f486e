package com.storyforge.orchestrator.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.dispatch.CancellationToken;
import com.storyforge.orchestrator.dispatch.JobCancelledException;
import com.storyforge.orchestrator.error.CycleException;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.error.ValidationException;
import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.workflow.nodes.AiImageNode;
import com.storyforge.orchestrator.workflow.nodes.AiVideoNode;
import com.storyforge.orchestrator.workflow.nodes.LlmProcessNode;
import com.storyforge.orchestrator.workflow.nodes.TextInputNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for WorkflowEngine: ordering, port mapping, failure handling and
 * resuming. Uses the real node types with a mocked GenerationClient plus two
 * test-only types, "echo" and "fail".
 */
@ExtendWith(MockitoExtension.class)
class WorkflowEngineTest {

    @Mock GenerationClient generation;

    EchoNode       echo;
    WorkflowEngine engine;
    List<String>   events;

    @BeforeEach
    void setUp() {
        echo = new EchoNode();
        NodeTypeRegistry registry = new NodeTypeRegistry(List.of(
                echo,
                new FailNode(),
                new TextInputNode(),
                new LlmProcessNode(generation),
                new AiImageNode(generation),
                new AiVideoNode(generation)));
        engine = new WorkflowEngine(registry);
        events = new ArrayList<>();
    }

    // ------------------------------------------------------------------
    // Topological sort
    // ------------------------------------------------------------------

    @Test
    void topologicalSort_chain() {
        engine.load(graph(List.of(echo("c"), echo("a"), echo("b")),
                List.of(edge("a", "b"), edge("b", "c"))));

        assertThat(engine.topologicalSort()).containsExactly("a", "b", "c");
    }

    @Test
    void topologicalSort_diamond_isDeterministic() {
        engine.load(graph(List.of(echo("a"), echo("b"), echo("c"), echo("d")),
                List.of(edge("a", "b"), edge("a", "c"), edge("b", "d"), edge("c", "d"))));

        assertThat(engine.topologicalSort()).containsExactly("a", "b", "c", "d");
        assertThat(engine.topologicalSort()).containsExactly("a", "b", "c", "d");
    }

    @Test
    void topologicalSort_cycle_throwsWithUnresolvedNodes() {
        engine.load(graph(List.of(echo("start"), echo("a"), echo("b")),
                List.of(edge("start", "a"), edge("a", "b"), edge("b", "a"))));

        assertThatThrownBy(() -> engine.topologicalSort())
                .isInstanceOf(CycleException.class)
                .satisfies(e -> assertThat(((CycleException) e).getUnresolved()).containsExactlyInAnyOrder("a", "b"));
    }

    @Test
    void execute_cycle_runsNothing() {
        engine.load(graph(List.of(echo("a"), echo("b")), List.of(edge("a", "b"), edge("b", "a"))));

        assertThatThrownBy(() -> engine.execute(NodeProgressListener.NONE, CancellationToken.none()))
                .isInstanceOf(CycleException.class);
        assertThat(echo.runs.get()).isZero();
    }

    // ------------------------------------------------------------------
    // Load
    // ------------------------------------------------------------------

    @Test
    void load_unknownType_fails() {
        WorkflowGraph graph = graph(List.of(new NodeSpec("x", "teleport", Map.of())), List.of());

        assertThatThrownBy(() -> engine.load(graph))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("teleport");
    }

    @Test
    void load_edgeToMissingNode_fails() {
        WorkflowGraph graph = graph(List.of(echo("a")), List.of(edge("a", "ghost")));

        assertThatThrownBy(() -> engine.load(graph)).isInstanceOf(ValidationException.class);
    }

    @Test
    void load_duplicateNodeId_fails() {
        WorkflowGraph graph = graph(List.of(echo("a"), echo("a")), List.of());

        assertThatThrownBy(() -> engine.load(graph))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Duplicate");
    }

    // ------------------------------------------------------------------
    // Execute
    // ------------------------------------------------------------------

    @Test
    void execute_mapsOutputPortsToInputPorts() {
        when(generation.completeText(eq("llm_process"), eq("Describe: a lighthouse"), any()))
                .thenReturn("a lighthouse at dusk");
        when(generation.generateImage(eq("a lighthouse at dusk"), anyMap())).thenReturn("https://cdn/img.png");
        when(generation.generateVideo(eq("https://cdn/img.png"), eq(""), anyMap())).thenReturn("https://cdn/clip.mp4");

        engine.load(graph(
                List.of(
                        new NodeSpec("video", "ai_video", Map.of()),
                        new NodeSpec("text",  "text_input", Map.of("text", "a lighthouse")),
                        new NodeSpec("llm",   "llm_process", Map.of("prompt_template", "Describe: {text}")),
                        new NodeSpec("image", "ai_image", Map.of())),
                List.of(
                        new EdgeSpec("text",  "llm",   "text",  "text"),
                        new EdgeSpec("llm",   "image", "text",  "prompt"),
                        new EdgeSpec("image", "video", "image", "image"))));

        Map<String, NodeResult> results = engine.execute(this::record, CancellationToken.none());

        assertThat(results).containsOnlyKeys("text", "llm", "image", "video");
        assertThat(results.get("video").outputs().get("video")).isEqualTo(PortValue.url("https://cdn/clip.mp4"));
        assertThat(events).containsExactly(
                "text:running", "text:completed",
                "llm:running", "llm:completed",
                "image:running", "image:completed",
                "video:running", "video:completed");
    }

    @Test
    void execute_failure_stopsAtFailingNode() {
        engine.load(graph(
                List.of(new NodeSpec("text", "text_input", Map.of("text", "hi")),
                        new NodeSpec("boom", "fail", Map.of()),
                        new NodeSpec("llm",  "llm_process", Map.of())),
                List.of(new EdgeSpec("text", "boom", "text", "text"),
                        new EdgeSpec("boom", "llm", "text", "text"))));

        assertThatThrownBy(() -> engine.execute(this::record, CancellationToken.none()))
                .isInstanceOf(NodeExecutionException.class)
                .satisfies(e -> {
                    NodeExecutionException ne = (NodeExecutionException) e;
                    assertThat(ne.getNodeId()).isEqualTo("boom");
                    assertThat(ne.getCategory()).isEqualTo(Category.NETWORK);
                    assertThat(ne.getMessage()).contains("upstream down");
                });

        assertThat(events).containsExactly("text:running", "text:completed", "boom:running", "boom:failed");
        assertThat(engine.results().get("boom").status()).isEqualTo(NodeStatus.FAILED);
        assertThat(engine.results()).doesNotContainKey("llm");
        verifyNoInteractions(generation);
    }

    @Test
    void execute_unmatchedPortName_leavesInputUnset() {
        engine.load(graph(List.of(echo("a"), echo("b")),
                List.of(new EdgeSpec("a", "b", "wrong", "input"))));

        Map<String, NodeResult> results = engine.execute(NodeProgressListener.NONE, CancellationToken.none());

        assertThat(results.get("b").outputs().get("output").value()).isEqualTo("b");
    }

    @Test
    void execute_cancelledToken_stopsBeforeNextNode() {
        CancellationToken token = CancellationToken.none();
        engine.load(graph(List.of(echo("a"), echo("b")), List.of(edge("a", "b"))));

        assertThatThrownBy(() -> engine.execute((id, status, r) -> {
            if (status == NodeStatus.COMPLETED) token.cancel();
        }, token)).isInstanceOf(JobCancelledException.class);

        assertThat(echo.runs.get()).isEqualTo(1);
        assertThat(engine.results()).containsOnlyKeys("a");
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    @Test
    void resumeFrom_skipsCompletedPrefix_andFeedsPriorOutputs() {
        engine.load(graph(List.of(echo("a"), echo("b"), echo("c")),
                List.of(edge("a", "b"), edge("b", "c"))));
        Map<String, NodeResult> prior = new LinkedHashMap<>();
        prior.put("a", completed("a"));
        prior.put("b", completed("a>b"));

        Map<String, NodeResult> results = engine.resumeFrom("b", prior, this::record, CancellationToken.none());

        assertThat(echo.runs.get()).isEqualTo(1);
        assertThat(events).containsExactly("c:running", "c:completed");
        assertThat(results).containsOnlyKeys("a", "b", "c");
        assertThat(results.get("c").outputs().get("output").value()).isEqualTo("a>b>c");
    }

    @Test
    void resumeFrom_unknownNode_fails() {
        engine.load(graph(List.of(echo("a")), List.of()));

        assertThatThrownBy(() -> engine.resumeFrom("zzz", Map.of(), NodeProgressListener.NONE, CancellationToken.none()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void resumePoint_isEndOfCompletedPrefix() {
        engine.load(graph(List.of(echo("a"), echo("b"), echo("c")),
                List.of(edge("a", "b"), edge("b", "c"))));

        assertThat(engine.resumePoint(Map.of())).isNull();
        assertThat(engine.resumePoint(Map.of("a", completed("a")))).isEqualTo("a");
        // c completed without b: only the unbroken prefix counts
        assertThat(engine.resumePoint(Map.of("a", completed("a"), "c", completed("c")))).isEqualTo("a");
        assertThat(engine.resumePoint(Map.of(
                "a", completed("a"),
                "b", NodeResult.failed("x")))).isEqualTo("a");
    }

    @Test
    void parse_editorDocument() {
        String json = """
                {"nodes": [
                   {"id": "t", "type": "text_input", "data": {"config": {"text": "hello", "max_length": 3}}},
                   {"id": "e", "type": "echo", "config": {}}
                 ],
                 "edges": [
                   {"source": "t", "target": "e", "sourceHandle": "text", "targetHandle": "input"}
                 ]}
                """;

        engine.load(WorkflowGraph.parse(json, new ObjectMapper()));
        Map<String, NodeResult> results = engine.execute(NodeProgressListener.NONE, CancellationToken.none());

        assertThat(results.get("t").outputs().get("text").value()).isEqualTo("hel");
        assertThat(results.get("e").outputs().get("output").value()).isEqualTo("hel>e");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void record(String nodeId, NodeStatus status, NodeResult result) {
        events.add(nodeId + ":" + status.value());
    }

    private static WorkflowGraph graph(List<NodeSpec> nodes, List<EdgeSpec> edges) {
        return new WorkflowGraph(nodes, edges);
    }

    private static NodeSpec echo(String id) {
        return new NodeSpec(id, "echo", Map.of("label", id));
    }

    private static EdgeSpec edge(String source, String target) {
        return new EdgeSpec(source, target, null, null);
    }

    private static NodeResult completed(String value) {
        return new NodeResult(NodeStatus.COMPLETED, Map.of("output", PortValue.text(value)), null, Instant.now());
    }

    /** Appends its label to whatever arrives on "input"; counts runs. */
    static final class EchoNode implements NodeDefinition {

        final AtomicInteger runs = new AtomicInteger();

        @Override public String       type()        { return "echo"; }
        @Override public String       displayName() { return "Echo"; }
        @Override public String       category()    { return "processing"; }
        @Override public List<String> inputPorts()  { return List.of("input"); }
        @Override public List<String> outputPorts() { return List.of("output"); }

        @Override
        public WorkflowNode create(Map<String, Object> config) {
            Object label = config.getOrDefault("label", "e");
            return inputs -> {
                runs.incrementAndGet();
                PortValue in = inputs.get("input");
                String value = in == null ? label.toString() : in.value() + ">" + label;
                return Map.of("output", PortValue.text(value));
            };
        }
    }

    static final class FailNode implements NodeDefinition {

        @Override public String       type()        { return "fail"; }
        @Override public String       displayName() { return "Fail"; }
        @Override public String       category()    { return "processing"; }
        @Override public List<String> inputPorts()  { return List.of("text"); }
        @Override public List<String> outputPorts() { return List.of("text"); }

        @Override
        public WorkflowNode create(Map<String, Object> config) {
            return inputs -> {
                throw new JobExecutionException(Category.NETWORK, "upstream down");
            };
        }
    }
}
