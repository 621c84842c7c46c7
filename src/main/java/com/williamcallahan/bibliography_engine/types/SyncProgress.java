package com.williamcallahan.bibliography_engine.types;

/**
 * Incremental progress of a reconciliation run.
 */
public record SyncProgress(int current, int total, String label) {
}
