/**
 * Storage contract for canonical paper records
 *
 * @author William Callahan
 *
 * Features:
 * - Lookup by surrogate id and by each cross-source identifier
 * - Deferred writes so a whole reconciliation run can flush once
 * - Implementations selected by whether a datasource URL is configured
 */
package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.Paper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PaperRepository {

    /**
     * Finds a paper by its surrogate id, including writes not yet flushed
     *
     * @param id paper id
     * @return the paper if present
     */
    Optional<Paper> findById(Long id);

    /**
     * All papers in insertion order
     */
    List<Paper> findAll();

    /**
     * Papers for the given ids, in the order of the ids; unknown ids are skipped
     */
    List<Paper> findAllByIds(Collection<Long> ids);

    /**
     * Case-insensitive DOI lookup
     */
    Optional<Paper> findByDoi(String doi);

    /**
     * arXiv lookup on the normalized id (prefix and version stripped)
     */
    Optional<Paper> findByArxivId(String arxivId);

    /**
     * Exact bibcode lookup
     */
    Optional<Paper> findByBibcode(String bibcode);

    /**
     * Inserts a new paper, assigning id and timestamps
     *
     * @param paper paper without id
     * @return the stored paper with its id
     */
    Paper add(Paper paper);

    /**
     * Updates an existing paper
     *
     * @param paper paper with id
     * @param flush when false the write is buffered until {@link #flush()}
     */
    void update(Paper paper, boolean flush);

    /**
     * Persists all buffered writes
     */
    void flush();

    /**
     * Whether the underlying library store is open and usable
     */
    boolean isAvailable();
}
