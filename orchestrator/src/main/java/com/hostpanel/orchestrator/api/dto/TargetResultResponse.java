package com.hostpanel.orchestrator.api.dto;

import com.hostpanel.orchestrator.model.TargetResult;

import java.time.Instant;

public record TargetResultResponse(
        String  targetId,
        String  status,
        String  stage,
        String  message,
        String  producedResourceId,
        Instant updatedAt
) {
    public static TargetResultResponse from(TargetResult t) {
        return new TargetResultResponse(
                t.targetId(),
                t.status().name(),
                t.stage(),
                t.message(),
                t.producedResourceId(),
                t.updatedAt()
        );
    }
}
