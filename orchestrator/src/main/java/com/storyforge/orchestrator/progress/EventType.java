package com.storyforge.orchestrator.progress;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum EventType {
    CONNECTED,
    STAGE_UPDATE,
    TOKEN,
    PROGRESS,
    DONE,
    ERROR,
    STREAM_END;

    /** done / error end a single-stage stream. */
    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }
}
