/**
 * One cached edge of a paper's reference or citation graph
 *
 * Features:
 * - Snapshot of the target work's identifiers and display metadata
 * - Attributed to the source plugin that produced it
 * - Resolved to a local paper when the target is already in the library
 */
package com.williamcallahan.bibliography_engine.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class CitationEdge {

    private Long id;
    private Long paperId;
    private String doi;
    private String arxivId;
    private String bibcode;
    /** Identifier local to the source plugin (e.g. an INSPIRE record id) */
    private String sourceRecordId;
    private String title;
    /** Authors joined with "; " */
    private String authors;
    private Integer year;
    private String journal;
    private Integer citationCount;
    private String sourcePlugin;
    private Instant cachedAt;
    private Long linkedPaperId;

    public boolean isInLibrary() {
        return linkedPaperId != null;
    }
}
