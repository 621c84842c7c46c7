package com.williamcallahan.bibliography_engine.types;

import lombok.Builder;
import lombok.Value;

/**
 * Inputs for a heuristic lookup when no exact identifier is available.
 */
@Value
@Builder
public class SearchQuery {
    String title;
    String firstAuthor;
    Integer year;
    String journal;

    public boolean isUsable() {
        return (title != null && !title.isBlank()) || (firstAuthor != null && year != null);
    }
}
