package com.example.fleetsafety.domain.convert;

import com.example.fleetsafety.domain.InvestigationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class InvestigationHistoryConverter implements AttributeConverter<List<InvestigationRecord>, String> {

    private static final TypeReference<ArrayList<InvestigationRecord>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<InvestigationRecord> attribute) {
        try {
            return JsonColumns.MAPPER.writeValueAsString(attribute != null ? attribute : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize investigation history", e);
        }
    }

    @Override
    public List<InvestigationRecord> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return new ArrayList<>();
        try {
            return JsonColumns.MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read investigation history", e);
        }
    }
}
