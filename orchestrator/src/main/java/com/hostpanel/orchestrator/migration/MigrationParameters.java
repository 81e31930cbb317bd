package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.service.JobException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the parameters persisted with a MIGRATION job.
 *
 * @param strategy null until resolved at submission
 */
public record MigrationParameters(
        Long           sourceHostId,
        Long           clusterId,
        String         node,
        String         storage,
        String         bridge,
        ImportStrategy strategy,
        boolean        startAfterImport
) {

    public static MigrationParameters from(Map<String, Object> params) {
        return new MigrationParameters(
                requiredLong(params, "sourceHostId"),
                requiredLong(params, "clusterId"),
                requiredText(params, "node"),
                requiredText(params, "storage"),
                requiredText(params, "bridge"),
                strategy(params.get("strategy")),
                Boolean.parseBoolean(String.valueOf(params.getOrDefault("startAfterImport", "false"))));
    }

    public MigrationParameters withStrategy(ImportStrategy chosen) {
        return new MigrationParameters(sourceHostId, clusterId, node, storage, bridge, chosen, startAfterImport);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sourceHostId",     sourceHostId);
        map.put("clusterId",        clusterId);
        map.put("node",             node);
        map.put("storage",          storage);
        map.put("bridge",           bridge);
        map.put("strategy",         strategy == null ? null : strategy.name());
        map.put("startAfterImport", startAfterImport);
        return map;
    }

    private static Long requiredLong(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw JobException.invalidInput("Parameter '" + key + "' must be a number, got '" + s + "'");
            }
        }
        throw JobException.invalidInput("Parameter '" + key + "' is required");
    }

    private static String requiredText(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            throw JobException.invalidInput("Parameter '" + key + "' is required");
        }
        return String.valueOf(value).trim();
    }

    private static ImportStrategy strategy(Object value) {
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        try {
            return ImportStrategy.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw JobException.invalidInput("Unknown import strategy '" + value + "'");
        }
    }
}
