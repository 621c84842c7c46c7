/**
 * Aggregate result of one reconciliation run
 *
 * @author William Callahan
 *
 * Features:
 * - Counts for updated, failed and skipped items out of the run's total
 * - Per-item errors and duplicate notices kept verbatim for display
 * - Cancellation flag set when the run stopped before covering every item
 */

package com.williamcallahan.bibliography_engine.types;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncOutcome {
    int total;
    int updated;
    int failed;
    int skipped;
    @Builder.Default
    List<SyncItemError> errors = List.of();
    @Builder.Default
    List<DuplicateNotice> duplicates = List.of();
    boolean cancelled;

    public int getProcessed() {
        return updated + failed + skipped;
    }

    public static SyncOutcome empty() {
        return SyncOutcome.builder().build();
    }
}
