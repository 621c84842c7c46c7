package com.williamcallahan.bibliography_engine.types;

/**
 * Per-item problem retained verbatim for the final report.
 */
public record SyncItemError(Long paperId, String title, SyncErrorKind kind, String message) {
}
