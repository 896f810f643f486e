package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.workflow.NodeDefinition;
import com.storyforge.orchestrator.workflow.PortValue;
import com.storyforge.orchestrator.workflow.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Image-to-video. Needs an image on the image port; prompt is optional. */
@Component
public class AiVideoNode implements NodeDefinition {

    private final GenerationClient generation;

    public AiVideoNode(GenerationClient generation) {
        this.generation = generation;
    }

    @Override public String       type()        { return "ai_video"; }
    @Override public String       displayName() { return "AI Video"; }
    @Override public String       category()    { return "ai"; }
    @Override public List<String> inputPorts()  { return List.of("image", "prompt"); }
    @Override public List<String> outputPorts() { return List.of("video"); }

    @Override
    public WorkflowNode create(Map<String, Object> config) {
        Map<String, Object> options = Map.of("duration", NodeConfig.integer(config, "duration", 5));
        return inputs -> {
            PortValue image = inputs.get("image");
            if (image == null) {
                throw NodeConfig.missing("ai_video needs an image input");
            }
            String prompt = NodeConfig.inputOrConfig(inputs, "prompt", config);
            String url = generation.generateVideo(image.value(), prompt == null ? "" : prompt, options);
            return Map.of("video", PortValue.url(url));
        };
    }
}
