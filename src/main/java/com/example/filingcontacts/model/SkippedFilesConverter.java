package com.example.filingcontacts.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the skipped-file list as a JSON array in a text column.
 */
@Converter
public class SkippedFilesConverter implements AttributeConverter<List<SkippedFile>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SkippedFile>> LIST_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<SkippedFile> attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize skipped files", e);
        }
    }

    @Override
    public List<SkippedFile> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(MAPPER.readValue(dbData, LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not read skipped files column", e);
        }
    }
}
