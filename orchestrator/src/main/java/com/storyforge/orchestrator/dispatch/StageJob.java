package com.storyforge.orchestrator.dispatch;

import com.storyforge.orchestrator.model.StageType;

import java.util.Map;
import java.util.UUID;

/** Everything a worker needs to run one attempt of a pipeline stage. */
public record StageJob(
        String              handle,
        StageType           stageType,
        UUID                projectId,
        Map<String, Object> input,
        String              userId
) {}
