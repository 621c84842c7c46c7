package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.repository.InMemoryPaperRepository;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.LookupClientRegistry;
import com.williamcallahan.bibliography_engine.service.lookup.RemoteLookupException;
import com.williamcallahan.bibliography_engine.types.SyncErrorKind;
import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import com.williamcallahan.bibliography_engine.types.SyncStartResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests citation-count refresh: changed counts only, punctuation-tolerant matching, shared run lock.
 */
class CitationCountRefreshServiceTest {

    private InMemoryPaperRepository paperRepository;
    private BibliographicLookupClient client;
    private SyncRunLock runLock;
    private CitationCountRefreshService service;

    @BeforeEach
    void setUp() {
        paperRepository = new InMemoryPaperRepository(Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
        client = Mockito.mock(BibliographicLookupClient.class);
        when(client.sourceName()).thenReturn("ads");
        when(client.isConfigured()).thenReturn(true);
        runLock = new SyncRunLock();
        service = new CitationCountRefreshService(paperRepository, new LookupClientRegistry(List.of(client)), runLock,
            new AppConfigurationProperties());
    }

    private Paper addPaper(String bibcode, Integer citationCount) {
        Paper paper = new Paper(null, "Paper " + bibcode);
        paper.setBibcode(bibcode);
        paper.setCitationCount(citationCount);
        return paperRepository.add(paper);
    }

    @Test
    void refreshCitationCounts_updatesOnlyChangedCounts() {
        Paper changed = addPaper("2016PhRvL.116f1102A", 100);
        Paper unchanged = addPaper("2019ApJ...870...55A", 7);
        Paper dotted = addPaper("2020MNRAS.491.1234X", null);
        paperRepository.add(new Paper(null, "No bibcode"));
        when(client.getCitationCounts(anyList())).thenReturn(Mono.just(Map.of(
            "2016PhRvL.116f1102A", 120,
            "2019ApJ...870...55A", 7,
            "2020MNRAS4911234X", 3)));

        SyncStartResult result = service.refreshCitationCounts(null);

        SyncOutcome outcome = result.getOutcome().orElseThrow();
        assertEquals(3, outcome.getTotal());
        assertEquals(2, outcome.getUpdated());
        assertEquals(1, outcome.getSkipped());
        assertEquals(120, paperRepository.findById(changed.getId()).orElseThrow().getCitationCount());
        assertEquals(7, paperRepository.findById(unchanged.getId()).orElseThrow().getCitationCount());
        assertEquals(3, paperRepository.findById(dotted.getId()).orElseThrow().getCitationCount());
        assertEquals(1, paperRepository.getFlushCount());
        verify(client).getCitationCounts(argThat(bibcodes -> bibcodes.size() == 3));
    }

    @Test
    void refreshCitationCounts_remoteFailureFailsEveryPaper() {
        addPaper("A", 1);
        addPaper("B", 2);
        when(client.getCitationCounts(anyList()))
            .thenReturn(Mono.error(new RemoteLookupException("ADS", "ADS API error: HTTP 429: Too Many Requests")));

        SyncOutcome outcome = service.refreshCitationCounts(null).getOutcome().orElseThrow();

        assertEquals(2, outcome.getFailed());
        assertEquals(1, outcome.getErrors().size());
        assertEquals(SyncErrorKind.REMOTE_FAILURE, outcome.getErrors().get(0).kind());
        assertEquals(1, paperRepository.findAll().get(0).getCitationCount());
    }

    @Test
    void refreshCitationCounts_busyWhileSyncRuns() {
        Optional<SyncCancellationToken> held = runLock.tryAcquire();

        assertEquals(SyncStartResult.Status.BUSY, service.refreshCitationCounts(null).getStatus());
        verifyNoMoreInteractions(ignoreStubs(client));
        runLock.release(held.orElseThrow());
    }

    @Test
    void refreshCitationCounts_rejectedWithoutTokenAndReleasesLock() {
        when(client.isConfigured()).thenReturn(false);

        SyncStartResult result = service.refreshCitationCounts(null);

        assertEquals(SyncStartResult.Status.REJECTED, result.getStatus());
        assertEquals("No ADS API token configured", result.getMessage());
        assertEquals(SyncState.IDLE, runLock.state());
    }

    @Test
    void refreshCitationCounts_noBibcodesMakesNoRemoteCall() {
        paperRepository.add(new Paper(null, "No bibcode"));

        SyncOutcome outcome = service.refreshCitationCounts(List.of()).getOutcome().orElseThrow();

        assertEquals(0, outcome.getTotal());
        verify(client, never()).getCitationCounts(anyList());
    }
}
