/**
 * Unit tests for InspireLookupClient
 *
 * @author William Callahan
 *
 * Features:
 * - Record id and bibcode batch queries with per-chunk failure reporting
 * - Query construction for DOI, arXiv, reference and citation lookups
 * - Smart search fall-through and all-strategies-failed error
 */
package com.williamcallahan.bibliography_engine.service.inspire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.config.InspireConfigurationProperties;
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

class InspireLookupClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InspireApiFetcher fetcher;
    private InspireLookupClient client;

    @BeforeEach
    void setUp() {
        fetcher = Mockito.mock(InspireApiFetcher.class);
        InspireConfigurationProperties inspireProperties = new InspireConfigurationProperties();
        inspireProperties.getApi().setBatchSize(2);
        client = new InspireLookupClient(fetcher, inspireProperties, new AppConfigurationProperties());
    }

    private JsonNode json(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static String hit(String recid, String bibcode, String title) {
        String external = bibcode == null ? ""
            : ",\"external_system_identifiers\":[{\"schema\":\"ADS\",\"value\":\"" + bibcode + "\"}]";
        return "{\"id\":\"" + recid + "\",\"metadata\":{\"titles\":[{\"title\":\"" + title + "\"}]" + external + "}}";
    }

    @Test
    void getByIdentifiers_bibcodesMatchExternalIdentifiersAndFailedChunkIsReported() {
        when(fetcher.search(eq("recid:1421100 or external_system_identifiers.value:\"2016PhRvL.116f1102A\""), eq(2), anyString()))
            .thenReturn(Mono.just(json("[" + hit("1421100", null, "By recid") + ","
                + hit("1421101", "2016PhRvL.116f1102A", "By bibcode") + "]")));
        when(fetcher.search(eq("recid:9"), eq(1), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("INSPIRE", "INSPIRE API error: HTTP 503: Service Unavailable")));

        StepVerifier.create(client.getByIdentifiers(List.of("1421100", " 2016PhRvL.116f1102A ", "9")))
            .assertNext(result -> {
                assertEquals(List.of("1421100", "1421101"),
                    result.found().stream().map(PaperMetadata::getSourceRecordId).toList());
                assertEquals("2016PhRvL.116f1102A", result.found().get(1).getBibcode());
                assertEquals(Map.of("9", "INSPIRE API error: HTTP 503: Service Unavailable"), result.failures());
            })
            .verifyComplete();
    }

    @Test
    void getByDoiAndArxiv_useInspireQuerySyntax() {
        when(fetcher.search(eq("doi 10.1103/PhysRevLett.116.061102"), eq(1), anyString()))
            .thenReturn(Mono.just(json("[" + hit("1421100", null, "GW150914") + "]")));
        when(fetcher.search(eq("eprint 1602.03837"), eq(1), anyString())).thenReturn(Mono.just(json("[]")));

        StepVerifier.create(client.getByDoi("https://doi.org/10.1103/PhysRevLett.116.061102"))
            .assertNext(metadata -> assertEquals("1421100", metadata.recordKey()))
            .verifyComplete();
        StepVerifier.create(client.getByArxiv("arXiv:1602.03837")).verifyComplete();
    }

    @Test
    void getByIdentifier_fetchesRecordAndCompletesEmptyWhenMissing() {
        when(fetcher.record("1421100")).thenReturn(Mono.just(json(hit("1421100", null, "GW150914"))));
        when(fetcher.record("404")).thenReturn(Mono.empty());

        StepVerifier.create(client.getByIdentifier("1421100"))
            .assertNext(metadata -> assertEquals("GW150914", metadata.getTitle()))
            .verifyComplete();
        StepVerifier.create(client.getByIdentifier("404")).verifyComplete();
    }

    @Test
    void getReferences_resolvesReferenceLinksInOneSearch() {
        when(fetcher.record("1421100")).thenReturn(Mono.just(json("""
            {"id": "1421100", "metadata": {"references": [
              {"record": {"$ref": "https://inspirehep.net/api/literature/42"}},
              {"record": {"$ref": "https://inspirehep.net/api/literature/7"}}
            ]}}
            """)));
        when(fetcher.search(eq("recid:42 or recid:7"), eq(2), anyString()))
            .thenReturn(Mono.just(json("[" + hit("42", null, "Ref A") + "," + hit("7", null, "Ref B") + "]")));

        StepVerifier.create(client.getReferences("1421100"))
            .assertNext(records -> assertEquals(List.of("42", "7"),
                records.stream().map(PaperMetadata::getSourceRecordId).toList()))
            .verifyComplete();
    }

    @Test
    void getReferences_recordWithoutLinkedReferencesIsEmptyWithoutSearch() {
        when(fetcher.record("5")).thenReturn(Mono.just(json("{\"id\":\"5\",\"metadata\":{}}")));

        StepVerifier.create(client.getReferences("5"))
            .assertNext(records -> assertTrue(records.isEmpty()))
            .verifyComplete();
        verify(fetcher, never()).search(anyString(), anyInt(), anyString());
    }

    @Test
    void getCitations_usesRefersToSortedByCitations() {
        when(fetcher.search(eq("refersto:recid:1421100"), eq(200), eq("mostcited")))
            .thenReturn(Mono.just(json("[" + hit("8", null, "Citing") + "]")));

        StepVerifier.create(client.getCitations("1421100"))
            .assertNext(records -> assertEquals("8", records.get(0).getSourceRecordId()))
            .verifyComplete();
    }

    @Test
    void getCitationCounts_keyedByRequestedIdentifier() {
        when(fetcher.search(anyString(), anyInt(), anyString()))
            .thenReturn(Mono.just(json("""
                [{"id": "1", "metadata": {"citation_count": 12}},
                 {"id": "2", "metadata": {"external_system_identifiers": [{"schema": "ADS", "value": "2020ApJ...1..1A"}]}}]
                """)));

        StepVerifier.create(client.getCitationCounts(List.of("1", "2020ApJ...1..1A")))
            .assertNext(counts -> assertEquals(Map.of("1", 12, "2020ApJ...1..1A", 0), counts))
            .verifyComplete();
    }

    @Test
    void exportCitationText_singleQueryForAllIdentifiers() {
        when(fetcher.bibtex("recid:1 or recid:2", 2)).thenReturn(Mono.just("@article{A,}\n@article{B,}"));

        StepVerifier.create(client.exportCitationText(List.of("1", "2")))
            .assertNext(text -> assertTrue(text.startsWith("@article{A")))
            .verifyComplete();
    }

    @Test
    void smartSearch_fallsThroughFailingStrategies() {
        SearchQuery query = SearchQuery.builder().title("Dark Matter Halos in Dwarf Galaxies").firstAuthor("Smith").year(2019).build();
        when(fetcher.search(anyString(), anyInt(), anyString())).thenReturn(Mono.just(json("[]")));
        when(fetcher.search(startsWith("t \"Dark Matter Halos in Dwarf Galaxies\" and a"), anyInt(), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("INSPIRE", "INSPIRE API error: timeout")));
        when(fetcher.search(eq("t \"Dark Matter Halos in Dwarf Galaxies\""), anyInt(), anyString()))
            .thenReturn(Mono.just(json("[" + hit("77", null, "Dark matter halos in dwarf galaxies") + "]")));

        StepVerifier.create(client.smartSearch(query))
            .assertNext(metadata -> assertEquals("77", metadata.getSourceRecordId()))
            .verifyComplete();
    }

    @Test
    void smartSearch_errorsOnlyWhenEveryStrategyFailed() {
        SearchQuery query = SearchQuery.builder().firstAuthor("Hubble").year(1929).build();
        when(fetcher.search(anyString(), anyInt(), anyString()))
            .thenReturn(Mono.error(new RemoteLookupException("INSPIRE", "INSPIRE API error: HTTP 500: Internal Server Error")));

        StepVerifier.create(client.smartSearch(query))
            .expectErrorMatches(e -> e instanceof RemoteLookupException && e.getMessage().contains("HTTP 500"))
            .verify();
    }

    @Test
    void descriptor_comesFromSourceSettings() {
        AppConfigurationProperties app = new AppConfigurationProperties();
        AppConfigurationProperties.Source inspire = new AppConfigurationProperties.Source();
        inspire.setCitations(true);
        inspire.setPriority(20);
        app.getSources().put("inspire", inspire);

        InspireLookupClient configured = new InspireLookupClient(fetcher, new InspireConfigurationProperties(), app);

        assertEquals("inspire", configured.sourceName());
        assertEquals(20, configured.descriptor().priority());
        assertTrue(configured.descriptor().capabilities().citations());
    }
}
