package com.hostpanel.orchestrator.model;

/**
 * Per-target stages of a migration.
 *
 * Happy path:
 *   DISCOVERING → DOWNLOADING → CONVERTING → UPLOADING → CREATING → COMPLETED
 *
 * The native import strategy goes straight from DISCOVERING to CREATING,
 * because the target hypervisor pulls the disks itself.
 * FAILED is reachable from any non-terminal stage.
 */
public enum MigrationStage {
    DISCOVERING,
    DOWNLOADING,
    CONVERTING,
    UPLOADING,
    CREATING,
    COMPLETED,
    FAILED
}
