package com.williamcallahan.bibliography_engine.types;

/**
 * Classification of per-item failures in a reconciliation run.
 * Not-found items and duplicates are skips rather than failures; a busy request is a
 * {@link SyncStartResult} status; extraction failures fall through to the next strategy.
 */
public enum SyncErrorKind {
    /** Network, timeout, rate-limit or parse error from the remote source */
    REMOTE_FAILURE,
    /** Applying a matched record to the library failed (merge or local write) */
    PROCESSING_FAILURE
}
