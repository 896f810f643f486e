package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.workflow.NodeDefinition;
import com.storyforge.orchestrator.workflow.PortValue;
import com.storyforge.orchestrator.workflow.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs the incoming text through the model using prompt_template, where
 * {@code {text}} is replaced by the input.
 */
@Component
public class LlmProcessNode implements NodeDefinition {

    private final GenerationClient generation;

    public LlmProcessNode(GenerationClient generation) {
        this.generation = generation;
    }

    @Override public String       type()        { return "llm_process"; }
    @Override public String       displayName() { return "LLM Process"; }
    @Override public String       category()    { return "ai"; }
    @Override public List<String> inputPorts()  { return List.of("text"); }
    @Override public List<String> outputPorts() { return List.of("text"); }

    @Override
    public WorkflowNode create(Map<String, Object> config) {
        String template = NodeConfig.string(config, "prompt_template");
        String effective = template == null ? "{text}" : template;
        return inputs -> {
            PortValue in = inputs.get("text");
            String text = in == null ? "" : in.value();
            String reply = generation.completeText(type(), effective.replace("{text}", text), chunk -> {});
            return Map.of("text", PortValue.text(reply));
        };
    }
}
