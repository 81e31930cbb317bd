package com.hostpanel.orchestrator.service;

import com.hostpanel.orchestrator.model.TargetResult;

/**
 * Non-failure result of processing a target. Failures are exceptions.
 */
public record TargetOutcome(boolean skipped, String producedResourceId, String message) {

    public static TargetOutcome success(String producedResourceId, String message) {
        return new TargetOutcome(false, producedResourceId, message);
    }

    public static TargetOutcome skipped(String message) {
        return new TargetOutcome(true, null, message);
    }

    TargetResult applyTo(TargetResult current) {
        return skipped
                ? current.skipped(message)
                : current.succeeded(producedResourceId, message);
    }
}
