package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.types.DuplicateNotice;
import com.williamcallahan.bibliography_engine.types.SyncErrorKind;
import com.williamcallahan.bibliography_engine.types.SyncItemError;
import com.williamcallahan.bibliography_engine.types.SyncOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run tallies. Items of one window record concurrently, so every method is synchronized.
 */
class SyncOutcomeAccumulator {

    private final int total;
    private int updated;
    private int failed;
    private int skipped;
    private final List<SyncItemError> errors = new ArrayList<>();
    private final List<DuplicateNotice> duplicates = new ArrayList<>();
    private final List<Paper> updatedPapers = new ArrayList<>();

    SyncOutcomeAccumulator(int total) {
        this.total = total;
    }

    synchronized void recordUpdated(Paper paper) {
        updated++;
        updatedPapers.add(paper);
    }

    synchronized void recordSkipped() {
        skipped++;
    }

    synchronized void recordFailed(Paper paper, SyncErrorKind kind, String message) {
        failed++;
        errors.add(new SyncItemError(paper.getId(), paper.getTitle(), kind, message));
    }

    synchronized void recordDuplicate(Paper paper, Long existingPaperId, String identifier) {
        skipped++;
        duplicates.add(new DuplicateNotice(paper.getId(), paper.getTitle(), existingPaperId, identifier));
    }

    /**
     * The buffered writes never reached the store: every item counted as updated becomes a failure.
     */
    synchronized void recordFlushFailure(String message) {
        for (Paper paper : updatedPapers) {
            errors.add(new SyncItemError(paper.getId(), paper.getTitle(), SyncErrorKind.PROCESSING_FAILURE, message));
        }
        failed += updatedPapers.size();
        updated = 0;
        updatedPapers.clear();
    }

    synchronized SyncOutcome toOutcome(boolean cancelled) {
        return SyncOutcome.builder()
            .total(total)
            .updated(updated)
            .failed(failed)
            .skipped(skipped)
            .errors(List.copyOf(errors))
            .duplicates(List.copyOf(duplicates))
            .cancelled(cancelled)
            .build();
    }
}
