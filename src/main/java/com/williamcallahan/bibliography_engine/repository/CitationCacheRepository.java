package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.types.CitationDirection;

import java.util.List;

/**
 * Storage for cached reference and citation edges.
 */
public interface CitationCacheRepository {

    /**
     * Deletes every edge of the paper in the given direction and inserts the new set
     * as a single unit of work.
     */
    void replaceEdges(CitationDirection direction, Long paperId, List<CitationEdge> edges);

    /**
     * Edges ordered by year descending (unknown years last), then insertion order
     */
    List<CitationEdge> findEdges(CitationDirection direction, Long paperId);

    /**
     * Sets the linked paper id on every edge whose DOI (case-insensitive), normalized arXiv id
     * or bibcode (exact) matches. Null identifiers are ignored.
     *
     * @return number of edges updated
     */
    int linkMatchingEdges(CitationDirection direction, Long linkedPaperId, String doi, String arxivId, String bibcode);
}
