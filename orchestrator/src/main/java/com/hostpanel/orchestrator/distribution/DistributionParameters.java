package com.hostpanel.orchestrator.distribution;

import com.hostpanel.orchestrator.service.JobException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of the parameters persisted with a DISTRIBUTION job.
 */
public record DistributionParameters(
        Long   sourceClusterId,
        String sourceNode,
        String filename,
        String sourceDir,
        String targetDir
) {

    static final String DEFAULT_IMAGE_DIR = "/var/lib/vz/template/iso";

    public static DistributionParameters from(Map<String, Object> params) {
        Object cluster = params.get("sourceClusterId");
        Long clusterId;
        try {
            clusterId = cluster instanceof Number n ? Long.valueOf(n.longValue()) : Long.valueOf(String.valueOf(cluster));
        } catch (NumberFormatException e) {
            throw JobException.invalidInput("Parameter 'sourceClusterId' is required and must be a number");
        }
        String filename = text(params, "filename", null);
        if (filename == null) {
            throw JobException.invalidInput("Parameter 'filename' is required");
        }
        if (filename.contains("/") || filename.equals("..")) {
            throw JobException.invalidInput("Parameter 'filename' must be a plain file name");
        }
        return new DistributionParameters(
                clusterId,
                text(params, "sourceNode", null),
                filename,
                text(params, "sourceDir", DEFAULT_IMAGE_DIR),
                text(params, "targetDir", DEFAULT_IMAGE_DIR));
    }

    public String sourcePath() {
        return sourceDir + "/" + filename;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sourceClusterId", sourceClusterId);
        map.put("sourceNode",      sourceNode);
        map.put("filename",        filename);
        map.put("sourceDir",       sourceDir);
        map.put("targetDir",       targetDir);
        return map;
    }

    private static String text(Map<String, Object> params, String key, String fallback) {
        Object value = params.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return fallback;
        }
        String s = String.valueOf(value).trim();
        return s.endsWith("/") && s.length() > 1 ? s.substring(0, s.length() - 1) : s;
    }
}
