/**
 * Unit tests for LibrarySyncController
 *
 * @author William Callahan
 *
 * Features:
 * - Maps run start results to HTTP status codes
 * - Verifies cancellation and status reporting
 * - Checks SSE framing of relayed sync events
 */

package com.williamcallahan.bibliography_engine.controller;

import com.williamcallahan.bibliography_engine.service.event.SyncCompletedEvent;
import com.williamcallahan.bibliography_engine.service.event.SyncEventStream;
import com.williamcallahan.bibliography_engine.service.event.SyncProgressEvent;
import com.williamcallahan.bibliography_engine.service.sync.CitationCountRefreshService;
import com.williamcallahan.bibliography_engine.service.sync.LibrarySyncService;
import com.williamcallahan.bibliography_engine.service.sync.SyncState;
import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import com.williamcallahan.bibliography_engine.types.SyncStartResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.ResponseEntity;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

class LibrarySyncControllerTest {

    private LibrarySyncController controller;
    private LibrarySyncService mockSyncService;
    private CitationCountRefreshService mockCountService;
    private SyncEventStream eventStream;

    @BeforeEach
    void setUp() {
        mockSyncService = Mockito.mock(LibrarySyncService.class);
        mockCountService = Mockito.mock(CitationCountRefreshService.class);
        eventStream = new SyncEventStream();
        controller = new LibrarySyncController(mockSyncService, mockCountService, eventStream);
    }

    @Test
    void startSync_acceptedWhenRunStarts() {
        Mockito.when(mockSyncService.startSynchronize(List.of(1L, 2L))).thenReturn(SyncStartResult.started(2));

        ResponseEntity<Map<String, Object>> resp = controller.startSync(List.of(1L, 2L));

        assertEquals(202, resp.getStatusCode().value());
        Map<String, Object> body = Objects.requireNonNull(resp.getBody());
        assertEquals(true, body.get("success"));
        assertEquals("STARTED", body.get("status"));
        assertEquals("Sync started for 2 paper(s)", body.get("message"));
        assertFalse(body.containsKey("results"));
    }

    @Test
    void startSync_conflictWhenBusy() {
        Mockito.when(mockSyncService.startSynchronize(null)).thenReturn(SyncStartResult.busy());

        ResponseEntity<Map<String, Object>> resp = controller.startSync(null);

        assertEquals(409, resp.getStatusCode().value());
        assertEquals(false, Objects.requireNonNull(resp.getBody()).get("success"));
    }

    @Test
    void startSync_badRequestWhenRejected() {
        Mockito.when(mockSyncService.startSynchronize(null))
            .thenReturn(SyncStartResult.rejected("No ADS API token configured"));

        ResponseEntity<Map<String, Object>> resp = controller.startSync(null);

        assertEquals(400, resp.getStatusCode().value());
        assertEquals("No ADS API token configured", Objects.requireNonNull(resp.getBody()).get("message"));
    }

    @Test
    void refreshCitationCounts_includesOutcome() {
        SyncOutcome outcome = SyncOutcome.builder().total(3).updated(2).skipped(1).build();
        Mockito.when(mockCountService.refreshCitationCounts(null)).thenReturn(SyncStartResult.completed(outcome));

        ResponseEntity<Map<String, Object>> resp = controller.refreshCitationCounts(null);

        assertEquals(200, resp.getStatusCode().value());
        Map<String, Object> body = Objects.requireNonNull(resp.getBody());
        assertEquals("Sync complete", body.get("message"));
        assertSame(outcome, body.get("results"));
    }

    @Test
    void cancelSync_reportsRequestAndState() {
        Mockito.when(mockSyncService.cancel()).thenReturn(true);
        Mockito.when(mockSyncService.status()).thenReturn(SyncState.CANCEL_REQUESTED);

        ResponseEntity<Map<String, Object>> resp = controller.cancelSync();

        Map<String, Object> body = Objects.requireNonNull(resp.getBody());
        assertEquals(true, body.get("cancelRequested"));
        assertEquals("CANCEL_REQUESTED", body.get("state"));
    }

    @Test
    void syncStatus_idle() {
        Mockito.when(mockSyncService.status()).thenReturn(SyncState.IDLE);

        assertEquals(Map.of("state", "IDLE"), controller.syncStatus().getBody());
    }

    @Test
    void streamSync_namesEventsByType() {
        SyncOutcome outcome = SyncOutcome.builder().total(1).updated(1).build();

        StepVerifier.create(controller.streamSync().take(2))
            .then(() -> {
                eventStream.onProgress(new SyncProgressEvent(1, 1, "Batch 1/1"));
                eventStream.onCompleted(new SyncCompletedEvent(outcome));
            })
            .assertNext(sse -> {
                assertEquals(SyncEventStream.PROGRESS, sse.event());
                assertEquals("Batch 1/1", Objects.requireNonNull(sse.data()).progress().label());
            })
            .assertNext(sse -> {
                assertEquals(SyncEventStream.COMPLETE, sse.event());
                assertSame(outcome, Objects.requireNonNull(sse.data()).outcome());
            })
            .verifyComplete();
    }
}
