/**
 * INSPIRE HEP implementation of the bibliographic lookup contract
 *
 * @author William Callahan
 *
 * Features:
 * - Records addressed by INSPIRE record id; ADS bibcodes resolved through external system identifiers
 * - Chunked batch lookups; a failed chunk is reported per identifier instead of failing the batch
 * - DOI and arXiv lookups with INSPIRE query syntax
 * - Multi-strategy smart search sharing the ADS candidate scoring
 * - BibTeX export, reference and citation graph retrieval, citation counts keyed by record id
 */
package com.williamcallahan.bibliography_engine.service.inspire;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.config.InspireConfigurationProperties;
import com.williamcallahan.bibliography_engine.mapper.InspirePaperMapper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.RemoteLookupException;
import com.williamcallahan.bibliography_engine.service.lookup.SearchCandidates;
import com.williamcallahan.bibliography_engine.types.BatchLookupResult;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import com.williamcallahan.bibliography_engine.types.SourceDescriptor;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.ExternalApiLogger;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Service
@Slf4j
public class InspireLookupClient implements BibliographicLookupClient {

    public static final String SOURCE_NAME = "inspire";

    private static final String DEFAULT_SORT = "mostrecent";
    private static final String CITED_SORT = "mostcited";

    private final InspireApiFetcher inspireApiFetcher;
    private final InspireConfigurationProperties inspireProperties;
    private final AppConfigurationProperties appProperties;

    public InspireLookupClient(InspireApiFetcher inspireApiFetcher,
                               InspireConfigurationProperties inspireProperties,
                               AppConfigurationProperties appProperties) {
        this.inspireApiFetcher = inspireApiFetcher;
        this.inspireProperties = inspireProperties;
        this.appProperties = appProperties;
    }

    @Override
    public SourceDescriptor descriptor() {
        AppConfigurationProperties.Source settings = appProperties.sourceSettings(SOURCE_NAME);
        return new SourceDescriptor(SOURCE_NAME, settings.toCapabilities(), settings.getPriority());
    }

    @Override
    public boolean isConfigured() {
        return inspireApiFetcher.isConfigured();
    }

    /**
     * Numeric identifiers are record ids; anything else is taken for an ADS bibcode and matched
     * against the records' external system identifiers. Chunks of {@code inspire.api.batch-size}
     * are independent.
     */
    @Override
    public Mono<BatchLookupResult> getByIdentifiers(List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return Mono.just(BatchLookupResult.empty());
        }
        List<String> cleaned = identifiers.stream()
            .filter(ValidationUtils::hasText)
            .map(String::trim)
            .toList();
        return fetchChunks(cleaned);
    }

    @Override
    public Mono<PaperMetadata> getByDoi(String doi) {
        String cleaned = IdentifierUtils.cleanDoi(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return first("getByDoi", "doi " + cleaned);
    }

    @Override
    public Mono<PaperMetadata> getByArxiv(String arxivId) {
        if (!ValidationUtils.hasText(arxivId)) {
            return Mono.empty();
        }
        String normalized = arxivId.trim().replace("arXiv:", "").replace("arxiv:", "");
        return first("getByArxiv", "eprint " + normalized);
    }

    /**
     * Single record by INSPIRE record id; a bibcode is searched instead
     */
    @Override
    public Mono<PaperMetadata> getByIdentifier(String identifier) {
        if (!ValidationUtils.hasText(identifier)) {
            return Mono.empty();
        }
        String trimmed = identifier.trim();
        if (!isRecid(trimmed)) {
            return first("getByBibcode", queryFor(trimmed));
        }
        return inspireApiFetcher.record(trimmed)
            .flatMap(record -> Mono.justOrEmpty(InspirePaperMapper.toPaperMetadata(record)));
    }

    /**
     * Tries each strategy in order and returns the first accepted candidate. The search only
     * signals an error when every strategy failed remotely.
     */
    @Override
    public Mono<PaperMetadata> smartSearch(SearchQuery query) {
        if (query == null || !query.isUsable()) {
            return Mono.empty();
        }
        List<InspireSmartSearch.Strategy> strategies = InspireSmartSearch.strategies(query);
        if (strategies.isEmpty()) {
            return Mono.empty();
        }
        AtomicInteger failures = new AtomicInteger();
        AtomicReference<Throwable> lastError = new AtomicReference<>();
        int rows = inspireProperties.getApi().getSearchRows();

        return Flux.fromIterable(strategies)
            .concatMap(strategy -> inspireApiFetcher.search(strategy.query(), rows, InspireSmartSearch.SORT)
                .map(InspirePaperMapper::toPaperMetadataList)
                .flatMap(docs -> {
                    var accepted = SearchCandidates.selectBest(query, docs, strategy.minSimilarity());
                    double similarity = docs.isEmpty() ? 0 : SearchCandidates.score(query, docs.get(0)).similarity();
                    ExternalApiLogger.logSearchStrategy(log, InspireApiFetcher.API_NAME, strategy.name(), strategy.query(),
                        accepted.map(SearchCandidates.Candidate::similarity).orElse(similarity), accepted.isPresent());
                    return Mono.justOrEmpty(accepted.map(SearchCandidates.Candidate::metadata));
                })
                .onErrorResume(e -> {
                    failures.incrementAndGet();
                    lastError.set(e);
                    log.warn("Strategy '{}' failed: {}", strategy.name(), ErrorHandlingUtils.describe(e));
                    return Mono.empty();
                }), 1)
            .next()
            .switchIfEmpty(Mono.defer(() -> {
                if (failures.get() == strategies.size() && lastError.get() != null) {
                    return Mono.error(asRemoteFailure(lastError.get()));
                }
                return Mono.empty();
            }));
    }

    /**
     * BibTeX for all identifiers in a single literature query
     */
    @Override
    public Mono<String> exportCitationText(List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return Mono.empty();
        }
        List<String> cleaned = identifiers.stream().filter(ValidationUtils::hasText).map(String::trim).toList();
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return inspireApiFetcher.bibtex(orQuery(cleaned), cleaned.size());
    }

    /**
     * Works referenced by the record, resolved from its reference links in one search
     */
    @Override
    public Mono<List<PaperMetadata>> getReferences(String recid) {
        if (!ValidationUtils.hasText(recid)) {
            return Mono.just(List.of());
        }
        int rows = inspireProperties.getApi().getReferencesRows();
        ExternalApiLogger.logApiCallAttempt(log, InspireApiFetcher.API_NAME, "references", recid);
        return inspireApiFetcher.record(recid.trim())
            .map(InspirePaperMapper::referenceRecids)
            .defaultIfEmpty(List.of())
            .flatMap(recids -> {
                if (recids.isEmpty()) {
                    return Mono.just(List.<PaperMetadata>of());
                }
                List<String> limited = recids.subList(0, Math.min(rows, recids.size()));
                return inspireApiFetcher.search(orQuery(limited), limited.size(), DEFAULT_SORT)
                    .map(InspirePaperMapper::toPaperMetadataList);
            })
            .doOnNext(records -> ExternalApiLogger.logApiCallSuccess(log, InspireApiFetcher.API_NAME, "references", recid, records.size()));
    }

    @Override
    public Mono<List<PaperMetadata>> getCitations(String recid) {
        if (!ValidationUtils.hasText(recid)) {
            return Mono.just(List.of());
        }
        String query = "refersto:recid:" + recid.trim();
        ExternalApiLogger.logApiCallAttempt(log, InspireApiFetcher.API_NAME, "citations", query);
        return inspireApiFetcher.search(query, inspireProperties.getApi().getCitationsRows(), CITED_SORT)
            .map(InspirePaperMapper::toPaperMetadataList)
            .doOnNext(records -> ExternalApiLogger.logApiCallSuccess(log, InspireApiFetcher.API_NAME, "citations", query, records.size()));
    }

    /**
     * Citation counts keyed by the identifier they were requested under, record id or bibcode.
     * A missing count is reported as 0.
     */
    @Override
    public Mono<Map<String, Integer>> getCitationCounts(List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return Mono.just(Map.of());
        }
        List<String> requested = identifiers.stream().filter(ValidationUtils::hasText).map(String::trim).toList();
        return fetchChunks(requested)
            .flatMap(result -> {
                if (result.found().isEmpty() && !result.failures().isEmpty()) {
                    return Mono.error(new RemoteLookupException(InspireApiFetcher.API_NAME,
                        result.failures().values().iterator().next()));
                }
                Map<String, Integer> counts = new LinkedHashMap<>();
                for (PaperMetadata metadata : result.found()) {
                    String key = requested.contains(metadata.getSourceRecordId())
                        ? metadata.getSourceRecordId()
                        : metadata.getBibcode();
                    if (key != null) {
                        counts.put(key, metadata.getCitationCount() == null ? 0 : metadata.getCitationCount());
                    }
                }
                return Mono.just(counts);
            });
    }

    private Mono<BatchLookupResult> fetchChunks(List<String> identifiers) {
        int batchSize = Math.max(1, inspireProperties.getApi().getBatchSize());
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < identifiers.size(); i += batchSize) {
            chunks.add(identifiers.subList(i, Math.min(i + batchSize, identifiers.size())));
        }
        return Flux.fromIterable(chunks)
            .index()
            .concatMap(indexed -> {
                List<String> chunk = indexed.getT2();
                return inspireApiFetcher.search(orQuery(chunk), chunk.size(), DEFAULT_SORT)
                    .map(InspirePaperMapper::toPaperMetadataList)
                    .doOnNext(found -> log.info("INSPIRE returned {} results for {} identifiers", found.size(), chunk.size()))
                    .map(found -> new BatchLookupResult(found, Map.of()))
                    .onErrorResume(e -> {
                        String message = ErrorHandlingUtils.describe(e);
                        log.error("Batch lookup failed for batch {}: {}", indexed.getT1(), message);
                        return Mono.just(BatchLookupResult.failedAll(chunk, message));
                    });
            })
            .collectList()
            .map(parts -> {
                List<PaperMetadata> found = new ArrayList<>();
                Map<String, String> failures = new LinkedHashMap<>();
                for (BatchLookupResult part : parts) {
                    found.addAll(part.found());
                    failures.putAll(part.failures());
                }
                return new BatchLookupResult(found, failures);
            });
    }

    private Mono<PaperMetadata> first(String operation, String query) {
        ExternalApiLogger.logApiCallAttempt(log, InspireApiFetcher.API_NAME, operation, query);
        return inspireApiFetcher.search(query, 1, DEFAULT_SORT)
            .flatMap(hits -> Mono.justOrEmpty(InspirePaperMapper.toPaperMetadataList(hits).stream().findFirst()))
            .doOnNext(found -> ExternalApiLogger.logApiCallSuccess(log, InspireApiFetcher.API_NAME, operation, query, 1));
    }

    static String orQuery(List<String> identifiers) {
        return identifiers.stream().map(InspireLookupClient::queryFor).collect(Collectors.joining(" or "));
    }

    private static String queryFor(String identifier) {
        return isRecid(identifier)
            ? "recid:" + identifier
            : "external_system_identifiers.value:\"" + identifier + "\"";
    }

    private static boolean isRecid(String identifier) {
        return identifier.chars().allMatch(Character::isDigit);
    }

    private static RemoteLookupException asRemoteFailure(Throwable e) {
        if (e instanceof RemoteLookupException remote) {
            return remote;
        }
        return new RemoteLookupException(InspireApiFetcher.API_NAME, "INSPIRE API error: " + ErrorHandlingUtils.describe(e), e);
    }
}
