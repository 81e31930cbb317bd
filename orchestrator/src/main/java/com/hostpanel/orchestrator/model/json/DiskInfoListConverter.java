package com.hostpanel.orchestrator.model.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hostpanel.orchestrator.model.DiskInfo;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class DiskInfoListConverter extends JsonAttributeConverter<List<DiskInfo>> {

    public DiskInfoListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<DiskInfo> empty() {
        return new ArrayList<>();
    }
}
