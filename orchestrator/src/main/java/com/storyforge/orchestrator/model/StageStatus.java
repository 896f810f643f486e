package com.storyforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum StageStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    /** Statuses resume() will pick the next stage from. */
    public static final Set<StageStatus> RESUMABLE = EnumSet.of(PENDING, FAILED);

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
