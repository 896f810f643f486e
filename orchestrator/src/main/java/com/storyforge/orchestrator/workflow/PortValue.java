package com.storyforge.orchestrator.workflow;

import com.fasterxml.jackson.annotation.JsonValue;
import com.storyforge.orchestrator.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A value travelling along an edge: a remote URL, a local file path, or
 * plain text for the text and LLM nodes.
 */
public record PortValue(Kind kind, String value) {

    public enum Kind {
        URL, FILE, TEXT;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static PortValue url(String value)  { return new PortValue(Kind.URL, value); }
    public static PortValue file(String value) { return new PortValue(Kind.FILE, value); }
    public static PortValue text(String value) { return new PortValue(Kind.TEXT, value); }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind",  kind.value());
        map.put("value", value);
        return map;
    }

    /** Inverse of {@link #toMap()}; also accepts the legacy {@code type} key. */
    public static PortValue fromMap(Map<?, ?> map) {
        Object kind = map.containsKey("kind") ? map.get("kind") : map.get("type");
        Object value = map.get("value");
        if (kind == null || value == null) {
            throw new ValidationException("Port value needs kind and value: " + map);
        }
        try {
            return new PortValue(Kind.valueOf(kind.toString().toUpperCase(Locale.ROOT)), value.toString());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown port value kind: " + kind);
        }
    }
}
