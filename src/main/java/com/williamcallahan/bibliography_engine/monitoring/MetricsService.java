/**
 * Service for tracking reconciliation metrics and remote-source health
 * Provides counters, gauges, and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.bibliography_engine.monitoring;

import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter syncRuns;
    private final Counter syncRejected;
    private final Counter papersUpdated;
    private final Counter papersFailed;
    private final Counter papersSkipped;
    private final Counter duplicates;
    private final Counter remoteRequests;

    // Gauges
    private final AtomicInteger activeSyncs = new AtomicInteger(0);
    private final AtomicLong remoteBytesReceived = new AtomicLong(0);

    // Timers
    private final Timer syncDuration;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.syncRuns = Counter.builder("sync.runs")
            .description("Number of library reconciliation runs executed")
            .register(meterRegistry);

        this.syncRejected = Counter.builder("sync.rejected")
            .description("Number of reconciliation requests rejected (busy or setup failure)")
            .register(meterRegistry);

        this.papersUpdated = Counter.builder("sync.papers.updated")
            .description("Papers updated from the remote source")
            .register(meterRegistry);

        this.papersFailed = Counter.builder("sync.papers.failed")
            .description("Papers whose lookup failed remotely")
            .register(meterRegistry);

        this.papersSkipped = Counter.builder("sync.papers.skipped")
            .description("Papers skipped as not found or duplicate")
            .register(meterRegistry);

        this.duplicates = Counter.builder("sync.duplicates")
            .description("Papers whose resolved bibcode belongs to another local paper")
            .register(meterRegistry);

        this.remoteRequests = Counter.builder("remote.requests")
            .description("Completed requests to bibliographic sources")
            .register(meterRegistry);

        // Initialize gauges
        Gauge.builder("sync.active", activeSyncs, AtomicInteger::get)
            .description("Number of reconciliation runs in progress")
            .register(meterRegistry);

        Gauge.builder("remote.bytes_received", remoteBytesReceived, AtomicLong::get)
            .description("Response bytes received from bibliographic sources")
            .register(meterRegistry);

        // Initialize timers
        this.syncDuration = Timer.builder("sync.duration")
            .description("Wall-clock duration of reconciliation runs")
            .register(meterRegistry);
    }

    public void recordSyncStarted() {
        syncRuns.increment();
        activeSyncs.incrementAndGet();
    }

    public void recordSyncRejected() {
        syncRejected.increment();
    }

    public void recordSyncFinished(SyncOutcome outcome, Duration elapsed) {
        activeSyncs.updateAndGet(current -> Math.max(0, current - 1));
        papersUpdated.increment(outcome.getUpdated());
        papersFailed.increment(outcome.getFailed());
        papersSkipped.increment(outcome.getSkipped());
        duplicates.increment(outcome.getDuplicates().size());
        syncDuration.record(elapsed);
    }

    public void recordRemoteResponse(long bytes) {
        remoteRequests.increment();
        remoteBytesReceived.addAndGet(Math.max(0, bytes));
    }

    public void recordRemoteFailure(String source, ErrorCategory category) {
        Counter.builder("remote.lookup.failures")
            .description("Failed lookups against bibliographic sources")
            .tag("source", source)
            .tag("category", category.name())
            .register(meterRegistry)
            .increment();
    }

    public int getActiveSyncs() {
        return activeSyncs.get();
    }
}
