package com.williamcallahan.bibliography_engine.types;

import com.williamcallahan.bibliography_engine.model.Paper;
import java.util.Optional;

/**
 * Outcome of a deduplication lookup. {@code isNew} means no canonical paper matched
 * and the caller decides whether to create one.
 */
public final class FindOrCreateResult {

    private final Paper paper;
    private final boolean isNew;

    private FindOrCreateResult(Paper paper, boolean isNew) {
        this.paper = paper;
        this.isNew = isNew;
    }

    public static FindOrCreateResult existing(Paper paper) {
        return new FindOrCreateResult(paper, false);
    }

    public static FindOrCreateResult notFound() {
        return new FindOrCreateResult(null, true);
    }

    public Optional<Paper> getPaper() {
        return Optional.ofNullable(paper);
    }

    public boolean isNew() {
        return isNew;
    }
}
