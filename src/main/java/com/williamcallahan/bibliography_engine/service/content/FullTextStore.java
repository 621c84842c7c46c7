package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.model.Paper;

import java.util.Optional;

/**
 * Read access to the cached full text of library papers.
 */
public interface FullTextStore {

    /**
     * @return the paper's text, or empty when the paper has no text path or the file is missing
     */
    Optional<String> readText(Paper paper);
}
