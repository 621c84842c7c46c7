package com.williamcallahan.bibliography_engine.service.sync;

/**
 * Lifecycle of the reconciliation run owned by one {@link SyncRunLock}.
 */
public enum SyncState {
    IDLE,
    RUNNING,
    /** A run is active and has been asked to stop at its next window or item boundary */
    CANCEL_REQUESTED
}
