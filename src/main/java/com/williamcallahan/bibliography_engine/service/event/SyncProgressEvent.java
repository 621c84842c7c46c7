package com.williamcallahan.bibliography_engine.service.event;

import com.williamcallahan.bibliography_engine.types.SyncProgress;

/**
 * Event published as a reconciliation run starts each window or item.
 */
public class SyncProgressEvent {
    private final int current;
    private final int total;
    private final String label;

    public SyncProgressEvent(int current, int total, String label) {
        this.current = current;
        this.total = total;
        this.label = label;
    }

    public int getCurrent() { return current; }
    public int getTotal() { return total; }
    public String getLabel() { return label; }

    public SyncProgress toProgress() {
        return new SyncProgress(current, total, label);
    }
}
