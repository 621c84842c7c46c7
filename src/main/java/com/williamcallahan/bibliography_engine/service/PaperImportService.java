/**
 * Import path for remote records into the library
 *
 * @author William Callahan
 *
 * Features:
 * - Consults the deduplicator before creating anything
 * - New papers get the importing source as their primary link
 * - Back-fills cached citation graphs that already mention the new paper
 * - Publishes PaperImportedEvent for listeners
 */
package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.service.event.PaperImportedEvent;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.LookupClientRegistry;
import com.williamcallahan.bibliography_engine.types.FindOrCreateResult;
import com.williamcallahan.bibliography_engine.types.PaperImportResult;
import com.williamcallahan.bibliography_engine.types.SourceDescriptor;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class PaperImportService {

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(30);

    private final PaperDeduplicationService deduplicationService;
    private final PaperSourceService paperSourceService;
    private final CitationCacheService citationCacheService;
    private final MetadataMergeService metadataMergeService;
    private final PaperRepository paperRepository;
    private final LookupClientRegistry lookupClientRegistry;
    private final ApplicationEventPublisher eventPublisher;

    public PaperImportService(PaperDeduplicationService deduplicationService,
                              PaperSourceService paperSourceService,
                              CitationCacheService citationCacheService,
                              MetadataMergeService metadataMergeService,
                              PaperRepository paperRepository,
                              LookupClientRegistry lookupClientRegistry,
                              ApplicationEventPublisher eventPublisher) {
        this.deduplicationService = deduplicationService;
        this.paperSourceService = paperSourceService;
        this.citationCacheService = citationCacheService;
        this.metadataMergeService = metadataMergeService;
        this.paperRepository = paperRepository;
        this.lookupClientRegistry = lookupClientRegistry;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Resolves a remote record to a library paper, creating one when no canonical match exists.
     * Serialized so two imports of the same work cannot both create a paper.
     *
     * @param metadata the remote record
     * @param source the source that produced it
     * @param sourceId the source's identifier for the record
     * @param sourceMetadata opaque metadata stored on the link
     */
    public synchronized PaperImportResult importPaper(PaperMetadata metadata, SourceDescriptor source,
                                                      String sourceId, Map<String, Object> sourceMetadata) {
        FindOrCreateResult found = deduplicationService.findOrCreatePaper(metadata, source, sourceId, sourceMetadata);
        if (!found.isNew() && found.getPaper().isPresent()) {
            Paper existing = found.getPaper().get();
            eventPublisher.publishEvent(new PaperImportedEvent(existing.getId(), source.name(), sourceId, false, 0));
            return new PaperImportResult(existing, false, 0);
        }

        Paper created = paperRepository.add(newPaper(metadata));
        if (ValidationUtils.hasText(sourceId)) {
            paperSourceService.addPaperSource(created.getId(), source, sourceId, sourceMetadata, true);
        }
        int linked = citationCacheService.updateLibraryLinks(created.getId());
        log.info("Imported new paper {} from {}:{} ({} cached edge(s) linked)", created.getId(), source.name(), sourceId, linked);
        eventPublisher.publishEvent(new PaperImportedEvent(created.getId(), source.name(), sourceId, true, linked));
        return new PaperImportResult(created, true, linked);
    }

    /**
     * Fetches a record from a named source by its canonical identifier and imports it
     *
     * @return empty when the source is unknown or has no such record
     */
    public Optional<PaperImportResult> importFromSource(String sourceName, String identifier) {
        Optional<BibliographicLookupClient> client = lookupClientRegistry.find(sourceName);
        if (client.isEmpty() || !ValidationUtils.hasText(identifier)) {
            return Optional.empty();
        }
        BibliographicLookupClient lookupClient = client.get();
        return lookupClient.getByIdentifier(identifier.trim())
            .blockOptional(LOOKUP_TIMEOUT)
            .map(metadata -> importPaper(metadata, lookupClient.descriptor(), identifier.trim(), Map.of()));
    }

    private Paper newPaper(PaperMetadata metadata) {
        Paper paper = metadataMergeService.mergeInto(new Paper(), metadata);
        String doi = IdentifierUtils.cleanDoi(paper.getDoi());
        paper.setDoi(doi.isEmpty() ? null : doi);
        return paper;
    }
}
