package com.hostpanel.orchestrator.model.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hostpanel.orchestrator.model.TargetResult;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class TargetResultListConverter extends JsonAttributeConverter<List<TargetResult>> {

    public TargetResultListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<TargetResult> empty() {
        return new ArrayList<>();
    }
}
