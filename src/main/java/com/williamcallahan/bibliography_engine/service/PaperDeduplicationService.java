/**
 * Central service for mapping external records onto canonical papers
 * Provides a unified entry point for finding existing papers by DOI, arXiv id or bibcode
 *
 * @author William Callahan
 *
 * Features:
 * - Identifier precedence: DOI (case-insensitive), then normalized arXiv id, then bibcode
 * - Records the external linkage on the matched paper without touching its metadata
 * - Leaves creation of new papers to the caller
 */

package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.types.FindOrCreateResult;
import com.williamcallahan.bibliography_engine.types.SourceDescriptor;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

@Service
public class PaperDeduplicationService {

    private static final Logger logger = LoggerFactory.getLogger(PaperDeduplicationService.class);

    private final PaperRepository paperRepository;
    private final PaperSourceService paperSourceService;

    public PaperDeduplicationService(PaperRepository paperRepository, PaperSourceService paperSourceService) {
        this.paperRepository = paperRepository;
        this.paperSourceService = paperSourceService;
    }

    /**
     * Finds the canonical paper for an incoming record, linking the source when one exists
     *
     * @param candidate incoming record's identifiers and metadata
     * @param source descriptor of the source that produced the record
     * @param sourceId the source's identifier for the record
     * @param sourceMetadata opaque metadata stored on the link
     * @return the existing paper with {@code isNew=false}, or {@code isNew=true} when nothing matched
     */
    public FindOrCreateResult findOrCreatePaper(PaperMetadata candidate, SourceDescriptor source,
                                                String sourceId, Map<String, Object> sourceMetadata) {
        Optional<Paper> existing = findCanonicalPaper(candidate);
        if (existing.isEmpty()) {
            return FindOrCreateResult.notFound();
        }
        Paper paper = existing.get();
        if (ValidationUtils.hasText(sourceId)) {
            paperSourceService.addPaperSource(paper.getId(), source, sourceId, sourceMetadata, false);
        }
        logger.info("Matched {} record {} to existing paper {}", source.name(), sourceId, paper.getId());
        return FindOrCreateResult.existing(paper);
    }

    /**
     * Canonical paper for the identifiers in {@code candidate}, checked in precedence order
     */
    public Optional<Paper> findCanonicalPaper(PaperMetadata candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        return findPaperByDoi(candidate.getDoi())
            .or(() -> findPaperByArxiv(candidate.getArxivId()))
            .or(() -> findPaperByBibcode(candidate.getBibcode()));
    }

    public Optional<Paper> findPaperByDoi(String doi) {
        return ValidationUtils.hasText(doi) ? paperRepository.findByDoi(doi) : Optional.empty();
    }

    public Optional<Paper> findPaperByArxiv(String arxivId) {
        return ValidationUtils.hasText(arxivId) ? paperRepository.findByArxivId(arxivId) : Optional.empty();
    }

    public Optional<Paper> findPaperByBibcode(String bibcode) {
        return ValidationUtils.hasText(bibcode) ? paperRepository.findByBibcode(bibcode) : Optional.empty();
    }
}
