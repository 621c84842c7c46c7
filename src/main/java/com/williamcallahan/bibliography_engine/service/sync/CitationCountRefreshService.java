package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.LookupClientRegistry;
import com.williamcallahan.bibliography_engine.types.SyncErrorKind;
import com.williamcallahan.bibliography_engine.types.SyncItemError;
import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import com.williamcallahan.bibliography_engine.types.SyncStartResult;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lightweight refresh of citation counts for papers that already have a bibcode.
 * Shares the run lock with full reconciliation, so the two never overlap.
 */
@Slf4j
@Service
public class CitationCountRefreshService {

    private final PaperRepository paperRepository;
    private final LookupClientRegistry lookupClientRegistry;
    private final SyncRunLock runLock;
    private final AppConfigurationProperties properties;

    public CitationCountRefreshService(PaperRepository paperRepository,
                                       LookupClientRegistry lookupClientRegistry,
                                       SyncRunLock runLock,
                                       AppConfigurationProperties properties) {
        this.paperRepository = paperRepository;
        this.lookupClientRegistry = lookupClientRegistry;
        this.runLock = runLock;
        this.properties = properties;
    }

    /**
     * @param paperIds papers to refresh; null or empty means every paper with a bibcode
     * @return COMPLETED with {@code updated} = counts that changed, BUSY, or REJECTED
     */
    public SyncStartResult refreshCitationCounts(List<Long> paperIds) {
        Optional<SyncCancellationToken> token = runLock.tryAcquire();
        if (token.isEmpty()) {
            return SyncStartResult.busy();
        }
        try {
            String sourceName = properties.getSync().getSource();
            Optional<BibliographicLookupClient> client = lookupClientRegistry.find(sourceName);
            if (client.isEmpty()) {
                return SyncStartResult.rejected("Unknown lookup source: " + sourceName);
            }
            if (!client.get().isConfigured()) {
                return SyncStartResult.rejected("No " + sourceName.toUpperCase(Locale.ROOT) + " API token configured");
            }
            if (!paperRepository.isAvailable()) {
                return SyncStartResult.rejected("Database not initialized");
            }
            return SyncStartResult.completed(refresh(paperIds, client.get()));
        } finally {
            runLock.release(token.get());
        }
    }

    private SyncOutcome refresh(List<Long> paperIds, BibliographicLookupClient client) {
        List<Paper> papers = (paperIds == null || paperIds.isEmpty()
                ? paperRepository.findAll()
                : paperRepository.findAllByIds(paperIds))
            .stream()
            .filter(Paper::hasBibcode)
            .toList();
        if (papers.isEmpty()) {
            return SyncOutcome.empty();
        }
        log.info("Updating citation counts for {} papers...", papers.size());

        Map<String, Integer> counts;
        try {
            counts = client.getCitationCounts(papers.stream().map(Paper::getBibcode).toList())
                .blockOptional(properties.getSync().getLookupTimeout())
                .orElse(Map.of());
        } catch (RuntimeException e) {
            String message = ErrorHandlingUtils.describe(e);
            log.error("Citation count update failed: {}", message);
            return SyncOutcome.builder()
                .total(papers.size())
                .failed(papers.size())
                .errors(List.of(new SyncItemError(null, null, SyncErrorKind.REMOTE_FAILURE, message)))
                .build();
        }

        Map<String, Integer> byExact = new HashMap<>(counts);
        Map<String, Integer> byNormalized = new HashMap<>();
        counts.forEach((bibcode, count) -> byNormalized.put(IdentifierUtils.normalizeBibcode(bibcode), count));

        int updated = 0;
        for (Paper paper : papers) {
            Integer count = byExact.get(paper.getBibcode());
            if (count == null) {
                count = byNormalized.get(IdentifierUtils.normalizeBibcode(paper.getBibcode()));
            }
            if (count != null && !Objects.equals(count, paper.getCitationCount())) {
                Paper changed = paper.copy();
                changed.setCitationCount(count);
                paperRepository.update(changed, false);
                updated++;
            }
        }
        paperRepository.flush();
        log.info("Updated citation counts for {} papers", updated);
        return SyncOutcome.builder()
            .total(papers.size())
            .updated(updated)
            .skipped(papers.size() - updated)
            .build();
    }
}
