package com.williamcallahan.bibliography_engine.service.event;

import com.williamcallahan.bibliography_engine.types.SyncOutcome;

/**
 * Event published exactly once when a reconciliation run ends, whether it finished or was cancelled.
 */
public class SyncCompletedEvent {
    private final SyncOutcome outcome;

    public SyncCompletedEvent(SyncOutcome outcome) {
        this.outcome = outcome;
    }

    public SyncOutcome getOutcome() { return outcome; }
    public boolean isCancelled() { return outcome.isCancelled(); }
}
