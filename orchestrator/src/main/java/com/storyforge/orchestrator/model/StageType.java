package com.storyforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.storyforge.orchestrator.error.ValidationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The fixed content pipeline. Declaration order IS the pipeline order.
 *
 * LLM stages stream tokens; media stages report per-item progress and get
 * a longer soft time limit for video.
 */
public enum StageType {

    REWRITE          ("Script Rewrite",   true,  Duration.ofSeconds(600)),
    STORYBOARD       ("Storyboard",       true,  Duration.ofSeconds(600)),
    IMAGE_GENERATION ("Image Generation", false, Duration.ofSeconds(600)),
    CAMERA_MOVEMENT  ("Camera Movement",  true,  Duration.ofSeconds(600)),
    VIDEO_GENERATION ("Video Generation", false, Duration.ofSeconds(1200));

    /** Immutable pipeline order, shared read-only across threads. */
    public static final List<StageType> PIPELINE = List.of(values());

    private final String   displayName;
    private final boolean  llm;
    private final Duration softTimeLimit;

    StageType(String displayName, boolean llm, Duration softTimeLimit) {
        this.displayName   = displayName;
        this.llm           = llm;
        this.softTimeLimit = softTimeLimit;
    }

    public String   displayName()   { return displayName; }
    public boolean  isLlm()         { return llm; }
    public Duration softTimeLimit() { return softTimeLimit; }

    /** Wire name, e.g. {@code image_generation}. Also used in channel keys. */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a wire name to a stage type.
     *
     * @throws ValidationException if the name is not part of the pipeline
     */
    public static StageType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("stage_name is required");
        }
        return Arrays.stream(values())
                .filter(t -> t.value().equals(name.trim().toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown stage: " + name));
    }
}
