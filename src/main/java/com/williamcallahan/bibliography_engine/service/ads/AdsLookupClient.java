/**
 * NASA ADS implementation of the bibliographic lookup contract
 *
 * @author William Callahan
 *
 * Features:
 * - Chunked bibcode lookups; a failed chunk is reported per bibcode instead of failing the batch
 * - DOI, arXiv and bibcode lookups with ADS query syntax
 * - Multi-strategy smart search with title similarity scoring
 * - BibTeX export plus reference and citation graph retrieval
 */
package com.williamcallahan.bibliography_engine.service.ads;

import com.williamcallahan.bibliography_engine.config.AdsConfigurationProperties;
import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.mapper.AdsPaperMapper;
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
public class AdsLookupClient implements BibliographicLookupClient {

    public static final String SOURCE_NAME = "ads";

    private static final String DEFAULT_SORT = "date desc";
    private static final String GRAPH_FIELDS = "bibcode,title,author,year";
    private static final String COUNT_FIELDS = "bibcode,citation_count";

    private final AdsApiFetcher adsApiFetcher;
    private final AdsConfigurationProperties adsProperties;
    private final AppConfigurationProperties appProperties;

    public AdsLookupClient(AdsApiFetcher adsApiFetcher,
                           AdsConfigurationProperties adsProperties,
                           AppConfigurationProperties appProperties) {
        this.adsApiFetcher = adsApiFetcher;
        this.adsProperties = adsProperties;
        this.appProperties = appProperties;
    }

    @Override
    public SourceDescriptor descriptor() {
        AppConfigurationProperties.Source settings = appProperties.sourceSettings(SOURCE_NAME);
        return new SourceDescriptor(SOURCE_NAME, settings.toCapabilities(), settings.getPriority());
    }

    @Override
    public boolean isConfigured() {
        return adsApiFetcher.isConfigured();
    }

    /**
     * Looks up bibcodes in chunks of {@code ads.api.batch-size}. Chunks are independent:
     * a chunk that fails after retries marks each of its bibcodes as failed with the chunk's message.
     */
    @Override
    public Mono<BatchLookupResult> getByIdentifiers(List<String> bibcodes) {
        if (bibcodes == null || bibcodes.isEmpty()) {
            return Mono.just(BatchLookupResult.empty());
        }
        List<String> cleaned = bibcodes.stream()
            .filter(ValidationUtils::hasText)
            .map(String::trim)
            .toList();
        return fetchChunks(cleaned, AdsApiFetcher.DEFAULT_FIELDS);
    }

    @Override
    public Mono<PaperMetadata> getByDoi(String doi) {
        String cleaned = IdentifierUtils.cleanDoi(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return first("getByDoi", "doi:\"" + cleaned + "\"");
    }

    @Override
    public Mono<PaperMetadata> getByArxiv(String arxivId) {
        if (!ValidationUtils.hasText(arxivId)) {
            return Mono.empty();
        }
        String normalized = arxivId.trim().replace("arXiv:", "").replace("arxiv:", "");
        return first("getByArxiv", "arxiv:" + normalized);
    }

    @Override
    public Mono<PaperMetadata> getByIdentifier(String bibcode) {
        if (!ValidationUtils.hasText(bibcode)) {
            return Mono.empty();
        }
        return first("getByBibcode", "bibcode:\"" + bibcode.trim() + "\"");
    }

    /**
     * Tries each strategy in order and returns the first accepted candidate.
     * A failing strategy is logged and the next one is tried; the search only signals an error
     * when every strategy failed remotely.
     */
    @Override
    public Mono<PaperMetadata> smartSearch(SearchQuery query) {
        if (query == null || !query.isUsable()) {
            return Mono.empty();
        }
        List<AdsSmartSearch.Strategy> strategies = AdsSmartSearch.strategies(query);
        if (strategies.isEmpty()) {
            return Mono.empty();
        }
        AtomicInteger failures = new AtomicInteger();
        AtomicReference<Throwable> lastError = new AtomicReference<>();
        int rows = adsProperties.getApi().getSearchRows();

        return Flux.fromIterable(strategies)
            .concatMap(strategy -> adsApiFetcher.search(strategy.query(), AdsApiFetcher.DEFAULT_FIELDS, rows, AdsSmartSearch.SORT)
                .map(AdsPaperMapper::toPaperMetadataList)
                .flatMap(docs -> {
                    var accepted = AdsSmartSearch.selectBest(query, docs, strategy);
                    double similarity = docs.isEmpty() ? 0 : SearchCandidates.score(query, docs.get(0)).similarity();
                    ExternalApiLogger.logSearchStrategy(log, AdsApiFetcher.API_NAME, strategy.name(), strategy.query(),
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
     * BibTeX for all bibcodes in a single export call
     */
    @Override
    public Mono<String> exportCitationText(List<String> bibcodes) {
        return adsApiFetcher.exportBibtex(bibcodes);
    }

    @Override
    public Mono<List<PaperMetadata>> getReferences(String bibcode) {
        return graph("references", bibcode, adsProperties.getApi().getReferencesRows());
    }

    @Override
    public Mono<List<PaperMetadata>> getCitations(String bibcode) {
        return graph("citations", bibcode, adsProperties.getApi().getCitationsRows());
    }

    /**
     * Citation counts keyed by the bibcode ADS reports. A missing count is reported as 0.
     */
    @Override
    public Mono<Map<String, Integer>> getCitationCounts(List<String> bibcodes) {
        if (bibcodes == null || bibcodes.isEmpty()) {
            return Mono.just(Map.of());
        }
        return fetchChunks(bibcodes.stream().filter(ValidationUtils::hasText).map(String::trim).toList(), COUNT_FIELDS)
            .flatMap(result -> {
                if (result.found().isEmpty() && !result.failures().isEmpty()) {
                    return Mono.error(new RemoteLookupException(AdsApiFetcher.API_NAME,
                        result.failures().values().iterator().next()));
                }
                Map<String, Integer> counts = new LinkedHashMap<>();
                for (PaperMetadata metadata : result.found()) {
                    counts.put(metadata.getBibcode(),
                        metadata.getCitationCount() == null ? 0 : metadata.getCitationCount());
                }
                return Mono.just(counts);
            });
    }

    private Mono<BatchLookupResult> fetchChunks(List<String> bibcodes, String fields) {
        int batchSize = Math.max(1, adsProperties.getApi().getBatchSize());
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < bibcodes.size(); i += batchSize) {
            chunks.add(bibcodes.subList(i, Math.min(i + batchSize, bibcodes.size())));
        }
        return Flux.fromIterable(chunks)
            .index()
            .concatMap(indexed -> {
                List<String> chunk = indexed.getT2();
                String query = chunk.stream().map(b -> "bibcode:\"" + b + "\"").collect(Collectors.joining(" OR "));
                return adsApiFetcher.search(query, fields, chunk.size(), DEFAULT_SORT)
                    .map(AdsPaperMapper::toPaperMetadataList)
                    .doOnNext(found -> log.info("ADS returned {} results for {} bibcodes", found.size(), chunk.size()))
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
        ExternalApiLogger.logApiCallAttempt(log, AdsApiFetcher.API_NAME, operation, query);
        return adsApiFetcher.search(query, AdsApiFetcher.DEFAULT_FIELDS, 1, DEFAULT_SORT)
            .flatMap(docs -> Mono.justOrEmpty(AdsPaperMapper.toPaperMetadataList(docs).stream().findFirst()))
            .doOnNext(found -> ExternalApiLogger.logApiCallSuccess(log, AdsApiFetcher.API_NAME, operation, query, 1));
    }

    private Mono<List<PaperMetadata>> graph(String function, String bibcode, int rows) {
        if (!ValidationUtils.hasText(bibcode)) {
            return Mono.just(List.of());
        }
        String query = function + "(bibcode:\"" + bibcode.trim() + "\")";
        ExternalApiLogger.logApiCallAttempt(log, AdsApiFetcher.API_NAME, function, query);
        return adsApiFetcher.search(query, GRAPH_FIELDS, rows, DEFAULT_SORT)
            .map(AdsPaperMapper::toPaperMetadataList)
            .doOnNext(records -> ExternalApiLogger.logApiCallSuccess(log, AdsApiFetcher.API_NAME, function, query, records.size()));
    }

    private static RemoteLookupException asRemoteFailure(Throwable e) {
        if (e instanceof RemoteLookupException remote) {
            return remote;
        }
        return new RemoteLookupException(AdsApiFetcher.API_NAME, "ADS API error: " + ErrorHandlingUtils.describe(e), e);
    }
}
