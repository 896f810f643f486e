package com.storyforge.orchestrator.dispatch;

import java.util.UUID;

/** One workflow execution to be driven by a worker. */
public record WorkflowJob(String handle, UUID projectId, UUID executionId) {}
