package com.hostpanel.orchestrator.model.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hostpanel.orchestrator.model.NetworkAdapter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class NetworkAdapterListConverter extends JsonAttributeConverter<List<NetworkAdapter>> {

    public NetworkAdapterListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<NetworkAdapter> empty() {
        return new ArrayList<>();
    }
}
