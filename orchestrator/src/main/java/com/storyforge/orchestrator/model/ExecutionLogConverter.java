package com.storyforge.orchestrator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/** JSON array column holding {@link ExecutionLogEntry} lines in append order. */
@Converter
public class ExecutionLogConverter implements AttributeConverter<List<ExecutionLogEntry>, String> {

    private static final ObjectMapper JSON = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public String convertToDatabaseColumn(List<ExecutionLogEntry> attribute) {
        try {
            return JSON.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialise execution logs", e);
        }
    }

    @Override
    public List<ExecutionLogEntry> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return new ArrayList<>();
        try {
            return JSON.readValue(dbData, new TypeReference<ArrayList<ExecutionLogEntry>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt execution log column: " + e.getOriginalMessage(), e);
        }
    }
}
