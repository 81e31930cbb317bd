package com.hostpanel.orchestrator.model.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;

/**
 * Base class for columns that hold a JSON document in a TEXT column.
 *
 * JPA instantiates converters itself, so these cannot use the Spring-managed
 * ObjectMapper; a private mapper with java.time support is configured here.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final TypeReference<T> type;

    protected JsonAttributeConverter(TypeReference<T> type) {
        this.type = type;
    }

    /** Value used when the column is NULL or blank. */
    protected abstract T empty();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        try {
            return attribute == null ? null : MAPPER.writeValueAsString(attribute);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot write " + type.getType() + " to JSON", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        try {
            return dbData == null || dbData.isBlank() ? empty() : MAPPER.readValue(dbData, type);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot read " + type.getType() + " from JSON", e);
        }
    }
}
