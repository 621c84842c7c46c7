package com.williamcallahan.bibliography_engine.types;

/**
 * A paper whose resolved bibcode, DOI or arXiv id already belongs to a different local paper.
 * {@code identifier} is the conflicting value.
 */
public record DuplicateNotice(Long paperId, String title, Long existingPaperId, String identifier) {
}
