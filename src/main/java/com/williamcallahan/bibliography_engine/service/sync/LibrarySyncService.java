/**
 * Batch reconciliation of library papers against a remote bibliographic source
 *
 * @author William Callahan
 *
 * Features:
 * - One active run at a time; a second request is answered "busy" without side effects
 * - Papers bucketed by known identifiers and processed in order: bibcode, DOI/arXiv, none
 * - Bibcode bucket resolved by one chunked batch lookup plus one citation-text export,
 *   then finished in fixed-width concurrent windows
 * - Cooperative cancellation checked before every window and every single-item lookup
 * - Writes buffered for the whole run and flushed once; a failed flush fails the updated items
 * - A paper never takes a bibcode, DOI or arXiv id already held by another paper
 * - Progress and completion published as application events
 */
package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.monitoring.MetricsService;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.service.CitationTextPartitioner;
import com.williamcallahan.bibliography_engine.service.event.SyncCompletedEvent;
import com.williamcallahan.bibliography_engine.service.event.SyncProgressEvent;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.LookupClientRegistry;
import com.williamcallahan.bibliography_engine.types.BatchLookupResult;
import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;
import com.williamcallahan.bibliography_engine.types.SyncErrorKind;
import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import com.williamcallahan.bibliography_engine.types.SyncStartResult;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

@Slf4j
@Service
public class LibrarySyncService {

    private final PaperRepository paperRepository;
    private final LookupClientRegistry lookupClientRegistry;
    private final PaperLookupChain lookupChain;
    private final PaperSyncFinisher finisher;
    private final SyncRunLock runLock;
    private final AppConfigurationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsService metricsService;
    private final TaskExecutor syncTaskExecutor;
    private final Clock clock;

    public LibrarySyncService(PaperRepository paperRepository,
                              LookupClientRegistry lookupClientRegistry,
                              PaperLookupChain lookupChain,
                              PaperSyncFinisher finisher,
                              SyncRunLock runLock,
                              AppConfigurationProperties properties,
                              ApplicationEventPublisher eventPublisher,
                              MetricsService metricsService,
                              @Qualifier("syncTaskExecutor") TaskExecutor syncTaskExecutor,
                              Clock clock) {
        this.paperRepository = paperRepository;
        this.lookupClientRegistry = lookupClientRegistry;
        this.lookupChain = lookupChain;
        this.finisher = finisher;
        this.runLock = runLock;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.syncTaskExecutor = syncTaskExecutor;
        this.clock = clock;
    }

    /**
     * Runs a reconciliation to the end on the calling thread
     *
     * @param paperIds papers to reconcile; null or empty means the whole library
     * @return COMPLETED with the outcome, BUSY, or REJECTED when setup checks fail
     */
    public SyncStartResult synchronize(List<Long> paperIds) {
        Optional<SyncCancellationToken> token = runLock.tryAcquire();
        if (token.isEmpty()) {
            metricsService.recordSyncRejected();
            return SyncStartResult.busy();
        }
        BibliographicLookupClient client;
        try {
            client = checkSetup();
        } catch (SyncSetupException e) {
            runLock.release(token.get());
            metricsService.recordSyncRejected();
            return SyncStartResult.rejected(e.getMessage());
        }
        return SyncStartResult.completed(run(token.get(), paperIds, client));
    }

    /**
     * Starts a reconciliation on the sync executor. The busy and setup checks happen on the caller's
     * thread so the answer is immediate.
     */
    public SyncStartResult startSynchronize(List<Long> paperIds) {
        Optional<SyncCancellationToken> token = runLock.tryAcquire();
        if (token.isEmpty()) {
            metricsService.recordSyncRejected();
            return SyncStartResult.busy();
        }
        BibliographicLookupClient client;
        int total;
        try {
            client = checkSetup();
            total = paperIds == null || paperIds.isEmpty()
                ? paperRepository.findAll().size()
                : paperRepository.findAllByIds(paperIds).size();
            syncTaskExecutor.execute(() -> run(token.get(), paperIds, client));
        } catch (SyncSetupException e) {
            runLock.release(token.get());
            metricsService.recordSyncRejected();
            return SyncStartResult.rejected(e.getMessage());
        } catch (RuntimeException e) {
            runLock.release(token.get());
            throw e;
        }
        return SyncStartResult.started(total);
    }

    /**
     * Asks the active run to stop at its next boundary
     *
     * @return false when no run is active
     */
    public boolean cancel() {
        boolean requested = runLock.requestCancel();
        if (requested) {
            log.info("Sync cancellation requested");
        }
        return requested;
    }

    public SyncState status() {
        return runLock.state();
    }

    private BibliographicLookupClient checkSetup() {
        String sourceName = properties.getSync().getSource();
        BibliographicLookupClient client = lookupClientRegistry.find(sourceName)
            .orElseThrow(() -> new SyncSetupException("Unknown lookup source: " + sourceName));
        if (!client.isConfigured()) {
            throw new SyncSetupException("No " + sourceName.toUpperCase(Locale.ROOT) + " API token configured");
        }
        if (!paperRepository.isAvailable()) {
            throw new SyncSetupException("Database not initialized");
        }
        return client;
    }

    private SyncOutcome run(SyncCancellationToken token, List<Long> paperIds, BibliographicLookupClient client) {
        Instant startedAt = clock.instant();
        metricsService.recordSyncStarted();
        SyncOutcome outcome = SyncOutcome.empty();
        try {
            outcome = execute(token, paperIds, client);
            return outcome;
        } finally {
            runLock.release(token);
            metricsService.recordSyncFinished(outcome, Duration.between(startedAt, clock.instant()));
        }
    }

    private SyncOutcome execute(SyncCancellationToken token, List<Long> paperIds, BibliographicLookupClient client) {
        List<Paper> papers = paperIds == null || paperIds.isEmpty()
            ? paperRepository.findAll()
            : paperRepository.findAllByIds(paperIds);
        PaperBuckets buckets = PaperBuckets.partition(papers);
        log.info("Sync: {} with bibcode, {} with doi/arxiv, {} with no ID",
            buckets.withBibcode().size(), buckets.withIdentifier().size(), buckets.withoutIdentifier().size());
        buckets.withoutIdentifier().forEach(paper -> log.warn("No identifier: \"{}\"", shortTitle(paper, 40)));

        RunContext context = new RunContext(token, client, new SyncOutcomeAccumulator(buckets.total()), buckets.total());

        processBibcodeBucket(buckets.withBibcode(), context);
        processSingles(buckets.withIdentifier(), buckets.withBibcode().size(), context,
            lookupChain::resolveByIdentifiers, paper -> paper.getTitle());
        processSingles(buckets.withoutIdentifier(), buckets.withBibcode().size() + buckets.withIdentifier().size(), context,
            lookupChain::resolveWithoutIdentifiers, paper -> "Lookup: " + shortTitle(paper, 40) + "...");

        try {
            paperRepository.flush();
        } catch (RuntimeException e) {
            String message = "Failed to save changes: " + ErrorHandlingUtils.describe(e);
            log.error("Sync flush failed: {}", e.getMessage(), e);
            context.accumulator.recordFlushFailure(message);
        }

        SyncOutcome outcome = context.accumulator.toOutcome(token.isCancellationRequested());
        log.info("Sync {}: {} updated, {} skipped, {} failed of {}",
            outcome.isCancelled() ? "cancelled" : "complete",
            outcome.getUpdated(), outcome.getSkipped(), outcome.getFailed(), outcome.getTotal());
        eventPublisher.publishEvent(new SyncCompletedEvent(outcome));
        return outcome;
    }

    private void processBibcodeBucket(List<Paper> papers, RunContext context) {
        if (papers.isEmpty()) {
            return;
        }
        List<String> bibcodes = papers.stream().map(Paper::getBibcode).toList();
        log.info("Batch fetching {} papers from {}...", bibcodes.size(), context.client.sourceName());
        BatchLookupResult batch = fetchBatch(bibcodes, context.client);

        Map<String, PaperMetadata> exact = new HashMap<>();
        Map<String, PaperMetadata> normalized = new HashMap<>();
        for (PaperMetadata record : batch.found()) {
            exact.put(record.getBibcode(), record);
            normalized.put(IdentifierUtils.normalizeBibcode(record.getBibcode()), record);
        }
        log.info("Fetched metadata for {}/{} papers", batch.found().size(), bibcodes.size());

        Map<String, String> citationTexts = fetchCitationTexts(bibcodes, context.client);

        int width = Math.max(1, properties.getSync().getWindowWidth());
        int windows = (papers.size() + width - 1) / width;
        for (int start = 0; start < papers.size(); start += width) {
            if (context.token.isCancellationRequested()) {
                log.warn("Sync cancelled");
                return;
            }
            List<Paper> window = papers.subList(start, Math.min(start + width, papers.size()));
            int windowNumber = start / width + 1;
            log.info("Batch {}/{}", windowNumber, windows);
            publishProgress(start + 1, context.total, "Batch " + windowNumber + "/" + windows);

            Flux.fromIterable(window)
                .flatMap(paper -> Mono.fromRunnable(() -> processBatchItem(paper, exact, normalized, batch, citationTexts, context))
                    .subscribeOn(Schedulers.boundedElastic()), width)
                .then()
                .block();

            if (start + width < papers.size()) {
                pauseBetweenWindows();
            }
        }
    }

    private void processBatchItem(Paper paper, Map<String, PaperMetadata> exact, Map<String, PaperMetadata> normalized,
                                  BatchLookupResult batch, Map<String, String> citationTexts, RunContext context) {
        try {
            PaperMetadata match = exact.get(paper.getBibcode());
            if (match == null) {
                match = normalized.get(IdentifierUtils.normalizeBibcode(paper.getBibcode()));
            }
            if (match == null) {
                LookupResolution fallback = lookupChain.resolveByDoiFallback(paper, context.client);
                if (!fallback.isFound()) {
                    String batchFailure = batch.failures().get(paper.getBibcode());
                    boolean fallbackAnswered = paper.hasDoi() && fallback.lastRemoteError() == null;
                    if (batchFailure != null && !fallbackAnswered) {
                        context.accumulator.recordFailed(paper, SyncErrorKind.REMOTE_FAILURE, batchFailure);
                    } else {
                        log.warn("[{}] Not found in {}", paper.getBibcode(), context.client.sourceName());
                        context.accumulator.recordSkipped();
                    }
                    return;
                }
                match = fallback.match();
            }
            finishMatched(paper, match, PaperIdentifiers.none(), citationTexts.get(paper.getBibcode()), context);
        } catch (RuntimeException e) {
            log.error("[{}] Sync failed: {}", paper.getBibcode(), e.getMessage(), e);
            context.accumulator.recordFailed(paper, SyncErrorKind.PROCESSING_FAILURE, ErrorHandlingUtils.describe(e));
        }
    }

    private void processSingles(List<Paper> papers, int offset, RunContext context,
                                BiFunction<Paper, BibliographicLookupClient, LookupResolution> resolver,
                                Function<Paper, String> label) {
        for (int i = 0; i < papers.size(); i++) {
            if (context.token.isCancellationRequested()) {
                log.warn("Sync cancelled");
                return;
            }
            Paper paper = papers.get(i);
            publishProgress(offset + i + 1, context.total, label.apply(paper));
            try {
                LookupResolution resolution = resolver.apply(paper, context.client);
                if (!resolution.isFound()) {
                    if (resolution.lastRemoteError() != null) {
                        context.accumulator.recordFailed(paper, SyncErrorKind.REMOTE_FAILURE, resolution.lastRemoteError());
                    } else {
                        log.info("[{}] No match found, skipping", shortTitle(paper, 40));
                        context.accumulator.recordSkipped();
                    }
                    continue;
                }
                finishMatched(paper, resolution.match(), resolution.discovered(), null, context);
            } catch (RuntimeException e) {
                log.error("Error syncing \"{}\": {}", shortTitle(paper, 30), e.getMessage(), e);
                context.accumulator.recordFailed(paper, SyncErrorKind.PROCESSING_FAILURE, ErrorHandlingUtils.describe(e));
            }
        }
    }

    private void finishMatched(Paper paper, PaperMetadata match, PaperIdentifiers discovered, String citationText,
                               RunContext context) {
        String label = ValidationUtils.hasText(match.recordKey()) ? match.recordKey() : match.getDoi();
        try {
            Paper merged = finisher.prepare(paper, match, discovered);
            Optional<IdentityConflict> conflict = findConflict(paper, merged, context);
            if (conflict.isPresent()) {
                IdentityConflict found = conflict.get();
                log.warn("DUPLICATE: paper {} (\"{}\") resolves to {} already held by paper {}",
                    paper.getId(), shortTitle(paper, 50), found.identifier(), found.ownerId());
                context.accumulator.recordDuplicate(paper, found.ownerId(), found.identifier());
                return;
            }
            finisher.finish(merged, match, citationText, context.client);
            context.accumulator.recordUpdated(merged);
        } catch (RuntimeException e) {
            log.error("[{}] Error applying record to paper {}: {}", label, paper.getId(), e.getMessage());
            context.accumulator.recordFailed(paper, SyncErrorKind.PROCESSING_FAILURE, ErrorHandlingUtils.describe(e));
        }
    }

    /**
     * Checks every identifier the merged paper would hold against the library and against the claims made
     * earlier in this run. Claims are taken only when nothing conflicts.
     */
    private Optional<IdentityConflict> findConflict(Paper paper, Paper merged, RunContext context) {
        Long id = paper.getId();
        Map<String, String> keys = new LinkedHashMap<>();
        if (ValidationUtils.hasText(merged.getBibcode())) {
            String bibcode = merged.getBibcode().trim();
            Optional<Paper> owner = paperRepository.findByBibcode(bibcode).filter(p -> !p.getId().equals(id));
            if (owner.isPresent()) {
                return Optional.of(new IdentityConflict(owner.get().getId(), bibcode));
            }
            keys.put("bibcode:" + bibcode, bibcode);
        }
        String doi = IdentifierUtils.normalizeDoi(merged.getDoi());
        if (doi != null) {
            Optional<Paper> owner = paperRepository.findByDoi(doi).filter(p -> !p.getId().equals(id));
            if (owner.isPresent()) {
                return Optional.of(new IdentityConflict(owner.get().getId(), doi));
            }
            keys.put("doi:" + doi, doi);
        }
        String arxivId = IdentifierUtils.normalizeArxivId(merged.getArxivId());
        if (arxivId != null) {
            Optional<Paper> owner = paperRepository.findByArxivId(arxivId).filter(p -> !p.getId().equals(id));
            if (owner.isPresent()) {
                return Optional.of(new IdentityConflict(owner.get().getId(), arxivId));
            }
            keys.put("arxiv:" + arxivId, arxivId);
        }
        return context.claim(id, keys);
    }

    private BatchLookupResult fetchBatch(List<String> bibcodes, BibliographicLookupClient client) {
        try {
            BatchLookupResult result = client.getByIdentifiers(bibcodes).block();
            return result != null ? result : BatchLookupResult.empty();
        } catch (RuntimeException e) {
            String message = ErrorHandlingUtils.describe(e);
            log.error("Batch lookup failed: {}", message);
            return BatchLookupResult.failedAll(bibcodes, message);
        }
    }

    private Map<String, String> fetchCitationTexts(List<String> bibcodes, BibliographicLookupClient client) {
        try {
            String export = client.exportCitationText(bibcodes).block();
            Map<String, String> partitioned = CitationTextPartitioner.partition(export, bibcodes);
            log.info("Got citation text for {} papers", partitioned.size());
            return partitioned;
        } catch (RuntimeException e) {
            log.warn("Citation text fetch failed: {}", ErrorHandlingUtils.describe(e));
            return Map.of();
        }
    }

    private void pauseBetweenWindows() {
        Duration delay = properties.getSync().getInterWindowDelay();
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            Mono.delay(delay).block();
        }
    }

    private void publishProgress(int current, int total, String label) {
        eventPublisher.publishEvent(new SyncProgressEvent(current, total, label));
    }

    private static String shortTitle(Paper paper, int length) {
        String title = paper.getTitle();
        if (!ValidationUtils.hasText(title)) {
            return "Untitled";
        }
        return title.length() > length ? title.substring(0, length) : title;
    }

    /**
     * State shared by every item of one run
     */
    private static final class RunContext {
        private final SyncCancellationToken token;
        private final BibliographicLookupClient client;
        private final SyncOutcomeAccumulator accumulator;
        private final int total;
        private final Map<String, Long> claims = new HashMap<>();

        private RunContext(SyncCancellationToken token, BibliographicLookupClient client,
                           SyncOutcomeAccumulator accumulator, int total) {
            this.token = token;
            this.client = client;
            this.accumulator = accumulator;
            this.total = total;
        }

        /**
         * @param keys claim key to the identifier it stands for
         * @return the first conflict, or empty once every key is claimed for {@code paperId}
         */
        private synchronized Optional<IdentityConflict> claim(Long paperId, Map<String, String> keys) {
            for (Map.Entry<String, String> key : keys.entrySet()) {
                Long owner = claims.get(key.getKey());
                if (owner != null && !owner.equals(paperId)) {
                    return Optional.of(new IdentityConflict(owner, key.getValue()));
                }
            }
            keys.keySet().forEach(key -> claims.put(key, paperId));
            return Optional.empty();
        }
    }

    private record IdentityConflict(Long ownerId, String identifier) {
    }

    /**
     * Setup check failure; reported as a rejected start, never thrown to callers
     */
    private static final class SyncSetupException extends RuntimeException {
        private SyncSetupException(String message) {
            super(message);
        }
    }
}
