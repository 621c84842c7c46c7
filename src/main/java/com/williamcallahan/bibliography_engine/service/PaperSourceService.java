/**
 * Registry of the external sources linked to each canonical paper
 *
 * @author William Callahan
 *
 * Features:
 * - Idempotent upsert of (paper, source) links with source-supplied capabilities and priority
 * - Best-source selection for reference and citation retrieval
 * - Link listing with graceful handling of undecodable metadata
 */

package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.model.PaperSource;
import com.williamcallahan.bibliography_engine.repository.PaperSourceRepository;
import com.williamcallahan.bibliography_engine.types.SourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

@Slf4j
@Service
public class PaperSourceService {

    // List.sort is stable, so equal candidates keep their input order
    private static final Comparator<PaperSource> PREFERENCE = Comparator
        .comparing(PaperSource::isPrimary).reversed()
        .thenComparingInt(PaperSource::getPriority);

    private final PaperSourceRepository paperSourceRepository;
    private final Clock clock;

    public PaperSourceService(PaperSourceRepository paperSourceRepository, Clock clock) {
        this.paperSourceRepository = paperSourceRepository;
        this.clock = clock;
    }

    /**
     * Attaches or replaces the link between a paper and an external record
     *
     * @param paperId canonical paper id
     * @param source descriptor of the calling source (name, capabilities, priority)
     * @param sourceId the source's own identifier for the record
     * @param metadata opaque source-specific metadata, may be null
     * @param primary whether this source is the paper's preferred source
     * @return the stored link
     */
    public PaperSource addPaperSource(Long paperId, SourceDescriptor source, String sourceId,
                                      Map<String, Object> metadata, boolean primary) {
        PaperSource link = PaperSource.builder()
            .paperId(paperId)
            .source(source.name())
            .sourceId(sourceId)
            .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
            .capabilities(source.capabilities())
            .priority(source.priority())
            .lastSynced(clock.instant())
            .primary(primary)
            .build();
        paperSourceRepository.upsert(link);
        log.debug("Linked paper {} to {}:{} (primary={}, priority={})",
            paperId, source.name(), sourceId, primary, source.priority());
        return link;
    }

    /**
     * All links for a paper, primary first then most recently synced
     */
    public List<PaperSource> getPaperSources(Long paperId) {
        return paperSourceRepository.findByPaperId(paperId);
    }

    /**
     * Preferred source for fetching the papers a work cites
     */
    public Optional<PaperSource> findBestSourceForRefs(List<PaperSource> sources) {
        return findBest(sources, PaperSource::hasReferences);
    }

    /**
     * Preferred source for fetching the papers citing a work
     */
    public Optional<PaperSource> findBestSourceForCites(List<PaperSource> sources) {
        return findBest(sources, PaperSource::hasCitations);
    }

    private Optional<PaperSource> findBest(List<PaperSource> sources, Predicate<PaperSource> capable) {
        if (sources == null || sources.isEmpty()) {
            return Optional.empty();
        }
        return sources.stream()
            .filter(capable)
            .sorted(PREFERENCE)
            .findFirst();
    }

    /**
     * Whole days elapsed since the given instant, or empty when never synced
     */
    public Optional<Long> daysSince(Instant timestamp) {
        if (timestamp == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(timestamp, clock.instant()).toDays());
    }
}
