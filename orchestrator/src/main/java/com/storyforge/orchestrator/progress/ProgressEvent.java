package com.storyforge.orchestrator.progress;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One progress message.
 *
 * On the wire an event is a flat JSON object: {@code type}, {@code project_id},
 * {@code stage} and {@code timestamp} followed by the type-specific fields
 * held in {@code data}. Workers build events without a scope; the publisher
 * stamps project and stage via {@link #scopedTo}.
 */
public record ProgressEvent(
        EventType           type,
        UUID                projectId,
        String              stage,
        Map<String, Object> data,
        Instant             timestamp
) {

    public ProgressEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        if (timestamp == null) timestamp = Instant.now();
    }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static ProgressEvent of(EventType type, Map<String, Object> data) {
        return new ProgressEvent(type, null, null, data, Instant.now());
    }

    public static ProgressEvent connected(String message) {
        return of(EventType.CONNECTED, Map.of("message", message));
    }

    public static ProgressEvent stageUpdate(String status, int progress, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status",   status);
        data.put("progress", progress);
        data.put("message",  message);
        return of(EventType.STAGE_UPDATE, data);
    }

    public static ProgressEvent token(String content, String fullText) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content",   content);
        data.put("full_text", fullText);
        return of(EventType.TOKEN, data);
    }

    public static ProgressEvent progress(int current, int total, String itemName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("current",   current);
        data.put("total",     total);
        data.put("item_name", itemName);
        return of(EventType.PROGRESS, data);
    }

    public static ProgressEvent done(Object result, Map<String, Object> metadata) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result",   result);
        data.put("metadata", metadata == null ? Map.of() : metadata);
        return of(EventType.DONE, data);
    }

    public static ProgressEvent error(String message, int retryCount) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message",     message);
        data.put("retry_count", retryCount);
        return of(EventType.ERROR, data);
    }

    public static ProgressEvent streamEnd(UUID projectId, String stage) {
        return new ProgressEvent(EventType.STREAM_END, projectId, stage,
                Map.of("message", "stream closed"), Instant.now());
    }

    // ------------------------------------------------------------------
    // Wire form
    // ------------------------------------------------------------------

    public ProgressEvent scopedTo(UUID projectId, String stage) {
        return new ProgressEvent(type, projectId, stage, data, timestamp);
    }

    /** Flat map for JSON encoding; envelope keys win over data keys. */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.value());
        if (projectId != null) payload.put("project_id", projectId.toString());
        if (stage != null)     payload.put("stage", stage);
        payload.put("timestamp", timestamp.toString());
        data.forEach(payload::putIfAbsent);
        return payload;
    }

    public static ProgressEvent fromPayload(Map<String, Object> payload) {
        Map<String, Object> data = new LinkedHashMap<>(payload);
        EventType type     = EventType.fromValue(String.valueOf(data.remove("type")));
        Object    project  = data.remove("project_id");
        Object    stage    = data.remove("stage");
        Object    ts       = data.remove("timestamp");
        return new ProgressEvent(
                type,
                project == null ? null : UUID.fromString(project.toString()),
                stage == null ? null : stage.toString(),
                data,
                ts == null ? Instant.now() : Instant.parse(ts.toString()));
    }
}
