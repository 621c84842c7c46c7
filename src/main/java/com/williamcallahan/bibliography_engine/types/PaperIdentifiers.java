package com.williamcallahan.bibliography_engine.types;

import lombok.Builder;
import lombok.Value;

/**
 * Best-effort identifiers pulled from free text or citation data. Any field may be null.
 */
@Value
@Builder(toBuilder = true)
public class PaperIdentifiers {
    String doi;
    String arxivId;
    String bibcode;

    public static PaperIdentifiers none() {
        return PaperIdentifiers.builder().build();
    }

    public boolean isEmpty() {
        return doi == null && arxivId == null && bibcode == null;
    }

    /**
     * Fills any missing field from {@code other}; fields already present win.
     */
    public PaperIdentifiers orElse(PaperIdentifiers other) {
        if (other == null) {
            return this;
        }
        return new PaperIdentifiers(
            doi != null ? doi : other.doi,
            arxivId != null ? arxivId : other.arxivId,
            bibcode != null ? bibcode : other.bibcode);
    }
}
