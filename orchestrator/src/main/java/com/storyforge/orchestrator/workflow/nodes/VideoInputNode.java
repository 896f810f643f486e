package com.storyforge.orchestrator.workflow.nodes;

import org.springframework.stereotype.Component;

@Component
public class VideoInputNode extends MediaInputNode {

    public VideoInputNode() {
        super("video");
    }

    @Override public String type()        { return "video_input"; }
    @Override public String displayName() { return "Video Input"; }
}
