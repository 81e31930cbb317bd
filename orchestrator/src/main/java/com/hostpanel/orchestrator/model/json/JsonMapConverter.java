package com.hostpanel.orchestrator.model.json;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected Map<String, Object> empty() {
        return new LinkedHashMap<>();
    }
}
