package com.hostpanel.orchestrator.api.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /jobs/distributions.
 *
 * sourceDir and targetDir default to the clusters' ISO directory.
 */
public record SubmitDistributionRequest(Long sourceClusterId, String sourceNode, String filename,
                                        String sourceDir, String targetDir,
                                        List<Long> targetClusterIds) {

    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sourceClusterId", sourceClusterId);
        params.put("sourceNode",      sourceNode);
        params.put("filename",        filename);
        params.put("sourceDir",       sourceDir);
        params.put("targetDir",       targetDir);
        return params;
    }

    public List<String> targetIds() {
        return targetClusterIds == null ? List.of() : targetClusterIds.stream().map(String::valueOf).toList();
    }
}
