package com.example.minimap_backend.util;

import com.example.minimap_backend.model.RenderConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RenderConfig} as JSON text so the column stays portable across databases.
 */
@Converter
public class RenderConfigConverter implements AttributeConverter<RenderConfig, String> {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @Override
    public String convertToDatabaseColumn(RenderConfig attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? RenderConfig.defaults() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Serialize render config failed", e);
        }
    }

    @Override
    public RenderConfig convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return RenderConfig.defaults();
        }
        try {
            return MAPPER.readValue(dbData, RenderConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Deserialize render config failed", e);
        }
    }
}
