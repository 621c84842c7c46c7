/**
 * Snapshot of one direction of a paper's citation graph as read from the cache
 *
 * @author William Callahan
 *
 * Features:
 * - Edges ordered by year descending, then insertion order
 * - Single source plugin and cached-at timestamp shared by every edge
 * - Staleness flag computed against the configured freshness window
 */

package com.williamcallahan.bibliography_engine.types;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import java.time.Instant;
import java.util.List;
import lombok.Value;

@Value
public class CachedCitationGraph {
    List<CitationEdge> edges;
    String sourcePlugin;
    Instant cachedAt;
    boolean stale;

    public static CachedCitationGraph empty() {
        return new CachedCitationGraph(List.of(), null, null, true);
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }
}
