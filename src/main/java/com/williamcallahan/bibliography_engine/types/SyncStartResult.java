package com.williamcallahan.bibliography_engine.types;

import java.util.Optional;

/**
 * Answer to a request to start a reconciliation run.
 */
public final class SyncStartResult {

    public enum Status {
        /** Run accepted and executing in the background */
        STARTED,
        /** Run executed to the end (natural completion or cancellation) */
        COMPLETED,
        /** Another run is active; nothing changed */
        BUSY,
        /** Setup check failed before any work began */
        REJECTED
    }

    private final Status status;
    private final String message;
    private final SyncOutcome outcome;

    private SyncStartResult(Status status, String message, SyncOutcome outcome) {
        this.status = status;
        this.message = message;
        this.outcome = outcome;
    }

    public static SyncStartResult started(int total) {
        return new SyncStartResult(Status.STARTED, "Sync started for " + total + " paper(s)", null);
    }

    public static SyncStartResult completed(SyncOutcome outcome) {
        return new SyncStartResult(Status.COMPLETED, outcome.isCancelled() ? "Sync cancelled" : "Sync complete", outcome);
    }

    public static SyncStartResult busy() {
        return new SyncStartResult(Status.BUSY, "Sync already in progress", null);
    }

    public static SyncStartResult rejected(String message) {
        return new SyncStartResult(Status.REJECTED, message, null);
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public Optional<SyncOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    public boolean isSuccess() {
        return status == Status.STARTED || status == Status.COMPLETED;
    }
}
