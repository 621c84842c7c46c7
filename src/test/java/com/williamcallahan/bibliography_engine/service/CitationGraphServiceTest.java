package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.repository.InMemoryCitationCacheRepository;
import com.williamcallahan.bibliography_engine.repository.InMemoryPaperRepository;
import com.williamcallahan.bibliography_engine.repository.InMemoryPaperSourceRepository;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.LookupClientRegistry;
import com.williamcallahan.bibliography_engine.service.lookup.RemoteLookupException;
import com.williamcallahan.bibliography_engine.types.CachedCitationGraph;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import com.williamcallahan.bibliography_engine.types.SourceCapabilities;
import com.williamcallahan.bibliography_engine.types.SourceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests cache-first graph retrieval with refresh from the best linked source.
 */
class CitationGraphServiceTest {

    private static final SourceDescriptor ADS =
        new SourceDescriptor("ads", new SourceCapabilities(true, true, true, true), 10);

    private InMemoryPaperRepository paperRepository;
    private PaperSourceService paperSourceService;
    private CitationCacheService citationCacheService;
    private BibliographicLookupClient adsClient;
    private CitationGraphService graphService;
    private Long paperId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        AppConfigurationProperties properties = new AppConfigurationProperties();
        paperRepository = new InMemoryPaperRepository(clock);
        paperSourceService = new PaperSourceService(new InMemoryPaperSourceRepository(), clock);
        citationCacheService = new CitationCacheService(new InMemoryCitationCacheRepository(), paperRepository, properties, clock);
        adsClient = Mockito.mock(BibliographicLookupClient.class);
        when(adsClient.sourceName()).thenReturn("ads");
        when(adsClient.descriptor()).thenReturn(ADS);
        when(adsClient.isConfigured()).thenReturn(true);
        graphService = new CitationGraphService(paperRepository, paperSourceService, citationCacheService,
            new LookupClientRegistry(List.of(adsClient)), properties);

        Paper paper = new Paper(null, "Linked paper");
        paper.setBibcode("2016PhRvL.116f1102A");
        paperId = paperRepository.add(paper).getId();
        paperSourceService.addPaperSource(paperId, ADS, "2016PhRvL.116f1102A", null, true);
    }

    private static PaperMetadata record(String bibcode, int year) {
        return PaperMetadata.builder().bibcode(bibcode).title("Title " + bibcode).authors(List.of("Doe, J.")).year(year).build();
    }

    @Test
    void getReferences_fetchesAndCachesWhenNothingCached() {
        when(adsClient.getReferences("2016PhRvL.116f1102A"))
            .thenReturn(Mono.just(List.of(record("1916SPAW.......688E", 1916), record("1975ApJ...195L..51H", 1975))));

        CachedCitationGraph graph = graphService.getReferences(paperId, false).orElseThrow();

        assertEquals(2, graph.getEdges().size());
        assertEquals("1975ApJ...195L..51H", graph.getEdges().get(0).getBibcode());
        assertEquals("ads", graph.getSourcePlugin());
        assertEquals("Doe, J.", graph.getEdges().get(0).getAuthors());
    }

    @Test
    void getCitations_freshCacheIsServedWithoutRemoteCall() {
        citationCacheService.cacheCitations(paperId, List.of(CitationEdge.builder().bibcode("cached").year(2020).build()), "ads");

        CachedCitationGraph graph = graphService.getCitations(paperId, false).orElseThrow();

        assertEquals("cached", graph.getEdges().get(0).getBibcode());
        verify(adsClient, never()).getCitations(anyString());
    }

    @Test
    void getCitations_forceRefreshReplacesSnapshot() {
        citationCacheService.cacheCitations(paperId, List.of(CitationEdge.builder().bibcode("cached").year(2020).build()), "ads");
        when(adsClient.getCitations("2016PhRvL.116f1102A")).thenReturn(Mono.just(List.of(record("2017fresh", 2017))));

        CachedCitationGraph graph = graphService.getCitations(paperId, true).orElseThrow();

        assertEquals(1, graph.getEdges().size());
        assertEquals("2017fresh", graph.getEdges().get(0).getBibcode());
    }

    @Test
    void getCitations_remoteFailureFallsBackToCachedSnapshot() {
        citationCacheService.cacheCitations(paperId, List.of(CitationEdge.builder().bibcode("cached").year(2020).build()), "ads");
        when(adsClient.getCitations(anyString())).thenReturn(Mono.error(new RemoteLookupException("ADS", "ADS API error: 503")));

        CachedCitationGraph graph = graphService.getCitations(paperId, true).orElseThrow();

        assertEquals("cached", graph.getEdges().get(0).getBibcode());
    }

    @Test
    void getReferences_unknownPaperIsEmpty() {
        assertTrue(graphService.getReferences(4242L, false).isEmpty());
        assertTrue(graphService.getReferences(null, false).isEmpty());
    }

    @Test
    void refresh_emptyWhenNoLinkedSourceOffersDirection() {
        Paper orphan = paperRepository.add(new Paper(null, "No links"));

        assertTrue(graphService.refresh(CitationDirection.REFERENCES, orphan.getId()).isEmpty());
        CachedCitationGraph graph = graphService.getReferences(orphan.getId(), false).orElseThrow();
        assertTrue(graph.isEmpty());
    }
}
