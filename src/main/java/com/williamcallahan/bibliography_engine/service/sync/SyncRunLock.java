package com.williamcallahan.bibliography_engine.service.sync;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the "at most one active run" state. The active run is represented by its cancellation token;
 * no token means idle.
 */
@Component
public class SyncRunLock {

    private final AtomicReference<SyncCancellationToken> active = new AtomicReference<>();

    /**
     * @return a fresh token when no run was active, empty when busy (state unchanged)
     */
    public Optional<SyncCancellationToken> tryAcquire() {
        SyncCancellationToken token = new SyncCancellationToken();
        return active.compareAndSet(null, token) ? Optional.of(token) : Optional.empty();
    }

    /**
     * Releases the lock if {@code token} still owns it
     */
    public void release(SyncCancellationToken token) {
        active.compareAndSet(token, null);
    }

    /**
     * @return true when a run was active and has now been asked to stop
     */
    public boolean requestCancel() {
        SyncCancellationToken token = active.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public SyncState state() {
        SyncCancellationToken token = active.get();
        if (token == null) {
            return SyncState.IDLE;
        }
        return token.isCancellationRequested() ? SyncState.CANCEL_REQUESTED : SyncState.RUNNING;
    }
}
