package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.PaperSource;

import java.util.List;
import java.util.Optional;

/**
 * Storage for paper-to-source links.
 */
public interface PaperSourceRepository {

    /**
     * Inserts or replaces the link. Any existing row for the same (paper, source) or for the
     * same (source, source id) is replaced, so one external record maps to exactly one paper.
     * A primary link demotes every other link of its paper.
     */
    void upsert(PaperSource link);

    /**
     * Links for a paper, primary first then most recently synced
     */
    List<PaperSource> findByPaperId(Long paperId);

    Optional<PaperSource> findBySourceId(String source, String sourceId);
}
