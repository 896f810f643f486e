package com.storyforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a project.
 *
 * PAUSED is only reachable from PROCESSING, and resume only leaves PAUSED.
 * Stored as the enum name; serialised to clients in lower case.
 */
public enum ProjectStatus {
    DRAFT,
    PROCESSING,
    COMPLETED,
    FAILED,
    PAUSED;

    /** Statuses from which a stage may be dispatched. */
    public static final Set<ProjectStatus> EXECUTABLE = EnumSet.of(DRAFT, PROCESSING, PAUSED);

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
