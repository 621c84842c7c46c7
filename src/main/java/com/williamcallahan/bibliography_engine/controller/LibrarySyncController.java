/**
 * REST controller for library reconciliation runs
 *
 * @author William Callahan
 *
 * Features:
 * - Starts runs in the background and reports busy or setup failures immediately
 * - Cooperative cancellation and run status
 * - Citation-count refresh
 * - Server-Sent Events stream of progress and completion
 */
package com.williamcallahan.bibliography_engine.controller;

import com.williamcallahan.bibliography_engine.service.event.SyncEventStream;
import com.williamcallahan.bibliography_engine.service.sync.CitationCountRefreshService;
import com.williamcallahan.bibliography_engine.service.sync.LibrarySyncService;
import com.williamcallahan.bibliography_engine.types.SyncStartResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class LibrarySyncController {

    private final LibrarySyncService librarySyncService;
    private final CitationCountRefreshService citationCountRefreshService;
    private final SyncEventStream syncEventStream;

    public LibrarySyncController(LibrarySyncService librarySyncService,
                                 CitationCountRefreshService citationCountRefreshService,
                                 SyncEventStream syncEventStream) {
        this.librarySyncService = librarySyncService;
        this.citationCountRefreshService = citationCountRefreshService;
        this.syncEventStream = syncEventStream;
    }

    /**
     * Starts a reconciliation run
     *
     * @param paperIds papers to reconcile; omitted or empty means the whole library
     * @return 202 when started, 409 when a run is active, 400 when setup checks fail
     */
    @PostMapping("/api/library/sync")
    public ResponseEntity<Map<String, Object>> startSync(@RequestBody(required = false) List<Long> paperIds) {
        SyncStartResult result = librarySyncService.startSynchronize(paperIds);
        log.info("Sync request for {} paper id(s): {}", paperIds == null ? "all" : paperIds.size(), result.getStatus());
        return toResponse(result);
    }

    @PostMapping("/api/library/sync/cancel")
    public ResponseEntity<Map<String, Object>> cancelSync() {
        boolean requested = librarySyncService.cancel();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cancelRequested", requested);
        body.put("state", librarySyncService.status().name());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/api/library/sync/status")
    public ResponseEntity<Map<String, Object>> syncStatus() {
        return ResponseEntity.ok(Map.of("state", librarySyncService.status().name()));
    }

    /**
     * Refreshes citation counts for papers with a bibcode; runs to completion before answering
     */
    @PostMapping("/api/library/citation-counts")
    public ResponseEntity<Map<String, Object>> refreshCitationCounts(@RequestBody(required = false) List<Long> paperIds) {
        return toResponse(citationCountRefreshService.refreshCitationCounts(paperIds));
    }

    @GetMapping(path = "/sse/library/sync", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SyncEventStream.SyncStreamEvent>> streamSync() {
        return syncEventStream.events()
            .map(event -> ServerSentEvent.<SyncEventStream.SyncStreamEvent>builder()
                .event(event.type())
                .data(event)
                .build());
    }

    private static ResponseEntity<Map<String, Object>> toResponse(SyncStartResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.isSuccess());
        body.put("status", result.getStatus().name());
        body.put("message", result.getMessage());
        result.getOutcome().ifPresent(outcome -> body.put("results", outcome));
        HttpStatus status = switch (result.getStatus()) {
            case STARTED -> HttpStatus.ACCEPTED;
            case COMPLETED -> HttpStatus.OK;
            case BUSY -> HttpStatus.CONFLICT;
            case REJECTED -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(body);
    }
}
