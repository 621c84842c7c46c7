/**
 * Contract for one external bibliographic source
 *
 * @author William Callahan
 *
 * Features:
 * - Identifier lookups keyed by the source's canonical identifier
 * - Heuristic search when no identifier is known
 * - Bulk citation-text export and citation-graph retrieval
 * - Every record is returned in the canonical PaperMetadata shape
 */
package com.williamcallahan.bibliography_engine.service.lookup;

import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.types.BatchLookupResult;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import com.williamcallahan.bibliography_engine.types.SourceDescriptor;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Lookups complete empty when nothing matches and signal {@link RemoteLookupException}
 * when the source could not be reached or answered with an error.
 */
public interface BibliographicLookupClient {

    /**
     * Name, capabilities and priority this source attaches to the links it creates
     */
    SourceDescriptor descriptor();

    default String sourceName() {
        return descriptor().name();
    }

    /**
     * Whether credentials and endpoint are configured
     */
    boolean isConfigured();

    /**
     * Looks up many records by canonical identifier in as few remote calls as the source allows
     */
    Mono<BatchLookupResult> getByIdentifiers(List<String> identifiers);

    Mono<PaperMetadata> getByDoi(String doi);

    Mono<PaperMetadata> getByArxiv(String arxivId);

    Mono<PaperMetadata> getByIdentifier(String identifier);

    /**
     * Heuristic search from title, first-author surname, year and journal
     */
    Mono<PaperMetadata> smartSearch(SearchQuery query);

    /**
     * Citation text (BibTeX) for all identifiers in one export
     */
    Mono<String> exportCitationText(List<String> identifiers);

    /**
     * Works cited by the record
     */
    Mono<List<PaperMetadata>> getReferences(String identifier);

    /**
     * Works citing the record
     */
    Mono<List<PaperMetadata>> getCitations(String identifier);

    /**
     * Current citation counts keyed by the identifier the source reports
     */
    Mono<Map<String, Integer>> getCitationCounts(List<String> identifiers);
}
