package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.workflow.NodeDefinition;
import com.storyforge.orchestrator.workflow.PortValue;
import com.storyforge.orchestrator.workflow.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Text-to-image. The prompt comes from the prompt port or from config. */
@Component
public class AiImageNode implements NodeDefinition {

    private final GenerationClient generation;

    public AiImageNode(GenerationClient generation) {
        this.generation = generation;
    }

    @Override public String       type()        { return "ai_image"; }
    @Override public String       displayName() { return "AI Image"; }
    @Override public String       category()    { return "ai"; }
    @Override public List<String> inputPorts()  { return List.of("prompt"); }
    @Override public List<String> outputPorts() { return List.of("image"); }

    @Override
    public WorkflowNode create(Map<String, Object> config) {
        Map<String, Object> options = Map.of(
                "width",  NodeConfig.integer(config, "width", 1024),
                "height", NodeConfig.integer(config, "height", 1024));
        return inputs -> {
            String prompt = NodeConfig.inputOrConfig(inputs, "prompt", config);
            if (prompt == null) {
                throw NodeConfig.missing("ai_image needs a prompt");
            }
            return Map.of("image", PortValue.url(generation.generateImage(prompt, options)));
        };
    }
}
