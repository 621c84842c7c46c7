package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.service.CitationCacheService;
import com.williamcallahan.bibliography_engine.service.CitationGraphService;
import com.williamcallahan.bibliography_engine.service.CitationTextPartitioner;
import com.williamcallahan.bibliography_engine.service.MetadataMergeService;
import com.williamcallahan.bibliography_engine.service.PaperSourceService;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Applies a matched remote record to a library paper. Shared by every bucket.
 * The write is buffered; the run flushes once at the end.
 */
@Slf4j
@Component
public class PaperSyncFinisher {

    private final PaperRepository paperRepository;
    private final MetadataMergeService metadataMergeService;
    private final PaperSourceService paperSourceService;
    private final CitationCacheService citationCacheService;
    private final CitationGraphService citationGraphService;
    private final AppConfigurationProperties properties;

    public PaperSyncFinisher(PaperRepository paperRepository,
                             MetadataMergeService metadataMergeService,
                             PaperSourceService paperSourceService,
                             CitationCacheService citationCacheService,
                             CitationGraphService citationGraphService,
                             AppConfigurationProperties properties) {
        this.paperRepository = paperRepository;
        this.metadataMergeService = metadataMergeService;
        this.paperSourceService = paperSourceService;
        this.citationCacheService = citationCacheService;
        this.citationGraphService = citationGraphService;
        this.properties = properties;
    }

    /**
     * Computes the paper as it would be written, without writing it
     *
     * @param paper the library paper as read at the start of the run
     * @param match the remote record it resolved to
     * @param discovered identifiers found by the lookup chain
     */
    Paper prepare(Paper paper, PaperMetadata match, PaperIdentifiers discovered) {
        Paper base = paper.copy();
        if (discovered != null) {
            if (ValidationUtils.hasText(discovered.getDoi())) {
                base.setDoi(discovered.getDoi());
            }
            if (ValidationUtils.hasText(discovered.getArxivId())) {
                base.setArxivId(discovered.getArxivId());
            }
        }
        return metadataMergeService.mergeInto(base, match);
    }

    /**
     * @param merged the result of {@link #prepare}
     * @param match the remote record it resolved to
     * @param citationText pre-fetched citation text for the record, null to fetch it when the paper has none
     * @param client the source that produced the match
     * @return the paper as written
     */
    Paper finish(Paper merged, PaperMetadata match, String citationText, BibliographicLookupClient client) {
        String recordKey = match.recordKey();
        String text = citationText;
        if (text == null && !ValidationUtils.hasText(merged.getCitationText())) {
            text = fetchCitationText(recordKey, client);
        }
        if (ValidationUtils.hasText(text)) {
            merged.setCitationText(text);
        }

        paperRepository.update(merged, false);
        if (ValidationUtils.hasText(recordKey)) {
            paperSourceService.addPaperSource(merged.getId(), client.descriptor(), recordKey, Map.of(), true);
        }
        citationCacheService.updateLibraryLinks(merged.getId());
        if (properties.getSync().isRefreshCitationGraphs()) {
            for (CitationDirection direction : CitationDirection.values()) {
                citationGraphService.refresh(direction, merged.getId());
            }
        }
        log.info("[{}] Updated paper {}", recordKey, merged.getId());
        return merged;
    }

    // A single-record export is that record's text even when no entry names the identifier
    private String fetchCitationText(String recordKey, BibliographicLookupClient client) {
        if (!ValidationUtils.hasText(recordKey)) {
            return null;
        }
        try {
            String export = client.exportCitationText(List.of(recordKey))
                .block(properties.getSync().getLookupTimeout());
            if (!ValidationUtils.hasText(export)) {
                return null;
            }
            String partitioned = CitationTextPartitioner.partition(export, List.of(recordKey)).get(recordKey);
            return partitioned != null ? partitioned : export.trim();
        } catch (RuntimeException e) {
            log.warn("[{}] Citation text fetch failed: {}", recordKey, ErrorHandlingUtils.describe(e));
            return null;
        }
    }
}
