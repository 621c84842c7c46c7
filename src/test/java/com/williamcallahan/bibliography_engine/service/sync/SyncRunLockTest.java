package com.williamcallahan.bibliography_engine.service.sync;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SyncRunLockTest {

    private final SyncRunLock lock = new SyncRunLock();

    @Test
    void tryAcquire_secondCallerIsRefusedUntilRelease() {
        Optional<SyncCancellationToken> first = lock.tryAcquire();

        assertTrue(first.isPresent());
        assertTrue(lock.tryAcquire().isEmpty());
        assertEquals(SyncState.RUNNING, lock.state());

        lock.release(first.get());
        assertEquals(SyncState.IDLE, lock.state());
        assertTrue(lock.tryAcquire().isPresent());
    }

    @Test
    void release_staleTokenDoesNotFreeNewerRun() {
        SyncCancellationToken old = lock.tryAcquire().orElseThrow();
        lock.release(old);
        SyncCancellationToken current = lock.tryAcquire().orElseThrow();

        lock.release(old);

        assertEquals(SyncState.RUNNING, lock.state());
        lock.release(current);
    }

    @Test
    void requestCancel_flagsActiveToken() {
        assertFalse(lock.requestCancel());
        SyncCancellationToken token = lock.tryAcquire().orElseThrow();

        assertTrue(lock.requestCancel());

        assertTrue(token.isCancellationRequested());
        assertEquals(SyncState.CANCEL_REQUESTED, lock.state());
    }

    @Test
    void tryAcquire_concurrentCallersGetExactlyOneToken() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        for (int i = 0; i < threads; i++) {
            executor.execute(() -> {
                try {
                    start.await();
                    lock.tryAcquire().ifPresent(token -> winners.incrementAndGet());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, winners.get());
    }
}
