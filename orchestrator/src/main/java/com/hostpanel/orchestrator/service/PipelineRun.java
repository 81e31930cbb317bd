package com.hostpanel.orchestrator.service;

/**
 * State of one pipeline execution between setup and cleanup.
 *
 * {@link #processTarget} is called once per target, in target order, on a
 * single worker thread. {@link #close} is always called after the last
 * target (or after cancellation) and must not throw for cleanup problems
 * that the caller cannot act on.
 */
public interface PipelineRun extends AutoCloseable {

    /**
     * Process one target.
     *
     * @return SUCCESS or SKIPPED outcome; failures are signalled by throwing
     */
    TargetOutcome processTarget(TargetContext target) throws Exception;

    /** Best-effort cleanup. */
    @Override
    default void close() {}
}
