package com.hostpanel.orchestrator.service;

/**
 * What a pipeline gets to know about the target it is processing.
 *
 * @param jobId    owning job
 * @param index    position of the target in the job's target list
 * @param targetId identifier submitted by the caller
 * @param stages   sink for stage-level progress; each report is persisted
 */
public record TargetContext(String jobId, int index, String targetId, StageReporter stages) {

    /** Receives stage transitions of a target that is still being processed. */
    @FunctionalInterface
    public interface StageReporter {
        void report(String stage, String message);
    }

    public void stage(Enum<?> stage, String message) {
        stages.report(stage.name(), message);
    }
}
