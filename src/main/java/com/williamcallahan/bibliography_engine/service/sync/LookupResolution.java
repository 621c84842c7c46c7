package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;

/**
 * Result of running a lookup chain for one paper.
 *
 * @param match the remote record, null when nothing matched
 * @param strategy name of the strategy that produced the match
 * @param discovered identifiers found along the way that led to the match (written back to the paper)
 * @param lastRemoteError message of the last remote failure, set only when every attempted call failed
 */
record LookupResolution(PaperMetadata match, String strategy, PaperIdentifiers discovered, String lastRemoteError) {

    static LookupResolution found(PaperMetadata match, String strategy, PaperIdentifiers discovered) {
        return new LookupResolution(match, strategy, discovered, null);
    }

    static LookupResolution notFound(String lastRemoteError) {
        return new LookupResolution(null, null, PaperIdentifiers.none(), lastRemoteError);
    }

    boolean isFound() {
        return match != null;
    }
}
