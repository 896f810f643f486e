package com.storyforge.orchestrator.workflow.nodes;

import org.springframework.stereotype.Component;

@Component
public class ImageInputNode extends MediaInputNode {

    public ImageInputNode() {
        super("image");
    }

    @Override public String type()        { return "image_input"; }
    @Override public String displayName() { return "Image Input"; }
}
