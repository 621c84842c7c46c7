package com.williamcallahan.bibliography_engine.types;

import lombok.Builder;
import lombok.Value;

/**
 * Metadata proposed by a free-form inference assist from a paper's text. Any field may be null.
 */
@Value
@Builder
public class InferredMetadata {
    String title;
    String firstAuthor;
    Integer year;
    String journal;
    String doi;
    String arxivId;

    public static InferredMetadata none() {
        return InferredMetadata.builder().build();
    }
}
