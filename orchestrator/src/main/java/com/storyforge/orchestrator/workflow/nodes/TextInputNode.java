package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.workflow.NodeDefinition;
import com.storyforge.orchestrator.workflow.PortValue;
import com.storyforge.orchestrator.workflow.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Emits the configured text, truncated to max_length (default 1000). */
@Component
public class TextInputNode implements NodeDefinition {

    static final int DEFAULT_MAX_LENGTH = 1000;

    @Override public String       type()        { return "text_input"; }
    @Override public String       displayName() { return "Text Input"; }
    @Override public String       category()    { return "input"; }
    @Override public List<String> inputPorts()  { return List.of(); }
    @Override public List<String> outputPorts() { return List.of("text"); }

    @Override
    public WorkflowNode create(Map<String, Object> config) {
        return inputs -> {
            String text = NodeConfig.string(config, "text");
            if (text == null) text = "";
            int max = NodeConfig.integer(config, "max_length", DEFAULT_MAX_LENGTH);
            if (max >= 0 && text.length() > max) {
                text = text.substring(0, max);
            }
            return Map.of("text", PortValue.text(text));
        };
    }
}
