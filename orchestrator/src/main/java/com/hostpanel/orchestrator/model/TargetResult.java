package com.hostpanel.orchestrator.model;

import java.time.Instant;

/**
 * Outcome of a single target (cluster, node or source VM) within a Job.
 *
 * Immutable: every transition returns a new instance. The owning Job keeps
 * these in submission order and persists them as a JSON array.
 *
 * @param targetId           identifier of the destination or of the VM being moved
 * @param status             PENDING until the target has been processed
 * @param stage              last pipeline stage reached (free-form, e.g. "CONVERTING"); may be null
 * @param message            human-readable outcome detail
 * @param producedResourceId resource created at the target (e.g. new VMID); only set on SUCCESS
 * @param updatedAt          time of the last transition
 */
public record TargetResult(
        String       targetId,
        TargetStatus status,
        String       stage,
        String       message,
        String       producedResourceId,
        Instant      updatedAt
) {

    public static TargetResult pending(String targetId) {
        return new TargetResult(targetId, TargetStatus.PENDING, null, "Waiting", null, Instant.now());
    }

    /** Record progress inside a still-pending target. */
    public TargetResult atStage(String newStage, String newMessage) {
        return new TargetResult(targetId, status, newStage, newMessage, producedResourceId, Instant.now());
    }

    public TargetResult succeeded(String resourceId, String newMessage) {
        return transition(TargetStatus.SUCCESS, newMessage, resourceId);
    }

    public TargetResult failed(String newMessage) {
        return transition(TargetStatus.FAILED, newMessage, null);
    }

    public TargetResult skipped(String newMessage) {
        return transition(TargetStatus.SKIPPED, newMessage, null);
    }

    public boolean isPending() {
        return status == TargetStatus.PENDING;
    }

    private TargetResult transition(TargetStatus next, String newMessage, String resourceId) {
        if (status != TargetStatus.PENDING) {
            throw new IllegalStateException(
                    "Target " + targetId + " already finished as " + status + ", cannot become " + next);
        }
        return new TargetResult(targetId, next, stage, newMessage, resourceId, Instant.now());
    }
}
