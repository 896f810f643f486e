package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.workflow.NodeDefinition;
import com.storyforge.orchestrator.workflow.PortValue;
import com.storyforge.orchestrator.workflow.WorkflowNode;

import java.util.List;
import java.util.Map;

/**
 * Shared shape of image_input and video_input: emit the configured
 * {@code <port>_url} as a URL value, else {@code <port>_file} as a file value.
 */
abstract class MediaInputNode implements NodeDefinition {

    private final String port;

    MediaInputNode(String port) {
        this.port = port;
    }

    @Override public String       category()    { return "input"; }
    @Override public List<String> inputPorts()  { return List.of(); }
    @Override public List<String> outputPorts() { return List.of(port); }

    @Override
    public WorkflowNode create(Map<String, Object> config) {
        return inputs -> {
            String url  = NodeConfig.string(config, port + "_url");
            String file = NodeConfig.string(config, port + "_file");
            if (url != null)  return Map.of(port, PortValue.url(url));
            if (file != null) return Map.of(port, PortValue.file(file));
            throw NodeConfig.missing(type() + " needs " + port + "_url or " + port + "_file");
        };
    }
}
