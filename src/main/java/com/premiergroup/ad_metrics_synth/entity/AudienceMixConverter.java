package com.premiergroup.ad_metrics_synth.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_metrics_synth.generator.AudienceMix;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores an {@link AudienceMix} as a JSON text column.
 */
@Converter
public class AudienceMixConverter implements AttributeConverter<AudienceMix, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(AudienceMix audienceMix) {
        if (audienceMix == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(audienceMix);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting audience mix to JSON", e);
        }
    }

    @Override
    public AudienceMix convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(dbData, AudienceMix.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting JSON to audience mix", e);
        }
    }
}
