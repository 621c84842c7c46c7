/**
 * Unit tests for AdsLookupClient
 *
 * @author William Callahan
 *
 * Features:
 * - Chunked batch lookups with per-chunk failure reporting
 * - Query construction for DOI, arXiv and graph lookups
 * - Smart search fall-through and all-strategies-failed error
 */
package com.williamcallahan.bibliography_engine.service.ads;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.bibliography_engine.config.AdsConfigurationProperties;
import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.service.lookup.RemoteLookupException;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AdsLookupClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AdsApiFetcher fetcher;
    private AdsConfigurationProperties adsProperties;
    private AdsLookupClient client;

    @BeforeEach
    void setUp() {
        fetcher = Mockito.mock(AdsApiFetcher.class);
        adsProperties = new AdsConfigurationProperties();
        adsProperties.getApi().setBatchSize(2);
        client = new AdsLookupClient(fetcher, adsProperties, new AppConfigurationProperties());
    }

    private JsonNode docs(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void getByIdentifiers_failedChunkIsReportedPerBibcode() {
        when(fetcher.search(eq("bibcode:\"A\" OR bibcode:\"B\""), anyString(), eq(2), anyString()))
            .thenReturn(Mono.just(docs("[{\"bibcode\":\"A\",\"title\":[\"Paper A\"]},{\"bibcode\":\"B\",\"title\":[\"Paper B\"]}]")));
        when(fetcher.search(eq("bibcode:\"C\""), anyString(), eq(1), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("ADS", "ADS API error: HTTP 503: Service Unavailable")));

        StepVerifier.create(client.getByIdentifiers(List.of("A", " B ", "C")))
            .assertNext(result -> {
                assertEquals(List.of("A", "B"), result.found().stream().map(PaperMetadata::getBibcode).toList());
                assertEquals(Map.of("C", "ADS API error: HTTP 503: Service Unavailable"), result.failures());
            })
            .verifyComplete();
        verify(fetcher, times(2)).search(anyString(), anyString(), anyInt(), anyString());
    }

    @Test
    void getByIdentifiers_emptyInputMakesNoCall() {
        StepVerifier.create(client.getByIdentifiers(List.of()))
            .assertNext(result -> assertTrue(result.found().isEmpty()))
            .verifyComplete();
        verifyNoInteractions(fetcher);
    }

    @Test
    void getByDoi_cleansDoiBeforeQuerying() {
        when(fetcher.search(eq("doi:\"10.1093/mnras/stx1234\""), anyString(), eq(1), anyString()))
            .thenReturn(Mono.just(docs("[{\"bibcode\":\"2017MNRAS.470.1234X\",\"doi\":[\"10.1093/mnras/stx1234\"]}]")));

        StepVerifier.create(client.getByDoi("https://doi.org/10.1093/mnras/stx1234/abstract"))
            .assertNext(metadata -> assertEquals("2017MNRAS.470.1234X", metadata.getBibcode()))
            .verifyComplete();
    }

    @Test
    void getByArxiv_stripsPrefixAndCompletesEmptyWhenUnknown() {
        when(fetcher.search(eq("arxiv:1602.03837"), anyString(), eq(1), anyString())).thenReturn(Mono.just(docs("[]")));

        StepVerifier.create(client.getByArxiv("arXiv:1602.03837")).verifyComplete();
    }

    @Test
    void getReferences_usesGraphOperatorAndConfiguredRows() {
        when(fetcher.search(eq("references(bibcode:\"2016PhRvL.116f1102A\")"), eq("bibcode,title,author,year"), eq(500), anyString()))
            .thenReturn(Mono.just(docs("[{\"bibcode\":\"R1\",\"year\":\"1916\"},{\"title\":[\"no bibcode\"]}]")));

        StepVerifier.create(client.getReferences("2016PhRvL.116f1102A"))
            .assertNext(records -> {
                assertEquals(1, records.size());
                assertEquals(1916, records.get(0).getYear());
            })
            .verifyComplete();
    }

    @Test
    void smartSearch_fallsThroughFailingStrategies() {
        SearchQuery query = SearchQuery.builder().title("Dark Matter Halos in Dwarf Galaxies").firstAuthor("Smith").year(2019).build();
        when(fetcher.search(anyString(), anyString(), anyInt(), anyString())).thenReturn(Mono.just(docs("[]")));
        when(fetcher.search(startsWith("title:\""), anyString(), anyInt(), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("ADS", "ADS API error: timeout")));
        when(fetcher.search(startsWith("title:("), anyString(), anyInt(), anyString()))
            .thenReturn(Mono.just(docs("[{\"bibcode\":\"2019ApJ...870...55S\",\"title\":[\"Dark matter halos in dwarf galaxies\"]}]")));

        StepVerifier.create(client.smartSearch(query))
            .assertNext(metadata -> assertEquals("2019ApJ...870...55S", metadata.getBibcode()))
            .verifyComplete();
    }

    @Test
    void smartSearch_errorsOnlyWhenEveryStrategyFailed() {
        SearchQuery query = SearchQuery.builder().firstAuthor("Hubble").year(1929).build();
        when(fetcher.search(anyString(), anyString(), anyInt(), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("ADS", "ADS API error: HTTP 500: Internal Server Error")));

        StepVerifier.create(client.smartSearch(query))
            .expectErrorMatches(e -> e instanceof RemoteLookupException && e.getMessage().contains("HTTP 500"))
            .verify();
    }

    @Test
    void smartSearch_noAcceptedCandidateCompletesEmpty() {
        SearchQuery query = SearchQuery.builder().firstAuthor("Hubble").year(1929).build();
        when(fetcher.search(anyString(), anyString(), anyInt(), anyString())).thenReturn(Mono.just(docs("[]")));

        StepVerifier.create(client.smartSearch(query)).verifyComplete();
        StepVerifier.create(client.smartSearch(SearchQuery.builder().build())).verifyComplete();
    }

    @Test
    void getCitationCounts_missingCountIsZero() {
        when(fetcher.search(anyString(), eq("bibcode,citation_count"), anyInt(), anyString()))
            .thenReturn(Mono.just(docs("[{\"bibcode\":\"A\",\"citation_count\":12},{\"bibcode\":\"B\"}]")));

        StepVerifier.create(client.getCitationCounts(List.of("A", "B")))
            .assertNext(counts -> assertEquals(Map.of("A", 12, "B", 0), counts))
            .verifyComplete();
    }

    @Test
    void getCitationCounts_errorsWhenEveryChunkFailed() {
        when(fetcher.search(anyString(), anyString(), anyInt(), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("ADS", "ADS API error: HTTP 401: Unauthorized")));

        StepVerifier.create(client.getCitationCounts(List.of("A")))
            .expectError(RemoteLookupException.class)
            .verify();
    }

    @Test
    void descriptor_comesFromSourceSettings() {
        AppConfigurationProperties app = new AppConfigurationProperties();
        AppConfigurationProperties.Source ads = new AppConfigurationProperties.Source();
        ads.setReferences(true);
        ads.setPriority(10);
        app.getSources().put("ads", ads);

        AdsLookupClient configured = new AdsLookupClient(fetcher, adsProperties, app);

        assertEquals("ads", configured.sourceName());
        assertEquals(10, configured.descriptor().priority());
        assertTrue(configured.descriptor().capabilities().references());
        assertFalse(configured.descriptor().capabilities().citations());
    }
}
