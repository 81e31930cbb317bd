package com.hostpanel.orchestrator.api.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /jobs/migrations.
 *
 * Required: sourceHostId, clusterId, node, storage, bridge, vms
 * Optional: strategy (FULL_PIPELINE | NATIVE_IMPORT; chosen from the cluster's
 *   capabilities when omitted), startAfterImport (default false)
 */
public record SubmitMigrationRequest(Long sourceHostId, Long clusterId, String node, String storage,
                                     String bridge, String strategy, Boolean startAfterImport,
                                     List<String> vms) {

    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sourceHostId",     sourceHostId);
        params.put("clusterId",        clusterId);
        params.put("node",             node);
        params.put("storage",          storage);
        params.put("bridge",           bridge);
        params.put("strategy",         strategy);
        params.put("startAfterImport", Boolean.TRUE.equals(startAfterImport));
        return params;
    }
}
