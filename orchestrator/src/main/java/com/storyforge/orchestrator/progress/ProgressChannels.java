package com.storyforge.orchestrator.progress;

import java.util.UUID;

/**
 * Channel keys. Clients depend on this exact format.
 */
public final class ProgressChannels {

    public static final String PATTERN = "project:*";

    private ProgressChannels() {}

    /** {@code project:<id>:stage:<stage>}, or {@code project:<id>} when stage is null. */
    public static String channel(UUID projectId, String stage) {
        return stage == null
                ? "project:" + projectId
                : "project:" + projectId + ":stage:" + stage;
    }
}
