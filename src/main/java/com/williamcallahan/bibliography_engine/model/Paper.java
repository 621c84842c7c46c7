/**
 * Canonical local record of a scholarly work
 *
 * Features:
 * - One record per work regardless of how many sources describe it
 * - Carries the three cross-source identifiers used for deduplication (DOI, arXiv id, bibcode)
 * - Holds merged bibliographic metadata and the citation-text blob
 * - Points at cached full text through a library-relative path
 */
package com.williamcallahan.bibliography_engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Paper {

    @EqualsAndHashCode.Include
    @ToString.Include
    private Long id;
    @ToString.Include
    private String doi;
    @ToString.Include
    private String arxivId;
    @ToString.Include
    private String bibcode;
    @ToString.Include
    private String title;
    private List<String> authors = new ArrayList<>();
    private Integer year;
    private String journal;
    private String abstractText;
    private List<String> keywords = new ArrayList<>();
    private Integer citationCount;
    private String citationText;
    private String textPath;
    private Instant createdAt;
    private Instant modifiedAt;

    public Paper(Long id, String title) {
        this.id = id;
        this.title = title;
    }

    public boolean hasBibcode() {
        return bibcode != null && !bibcode.isBlank();
    }

    public boolean hasDoi() {
        return doi != null && !doi.isBlank();
    }

    public boolean hasArxivId() {
        return arxivId != null && !arxivId.isBlank();
    }

    /**
     * Detached copy so callers cannot mutate a stored instance in place.
     */
    public Paper copy() {
        Paper copy = new Paper(id, title);
        copy.setDoi(doi);
        copy.setArxivId(arxivId);
        copy.setBibcode(bibcode);
        copy.setAuthors(authors == null ? new ArrayList<>() : new ArrayList<>(authors));
        copy.setYear(year);
        copy.setJournal(journal);
        copy.setAbstractText(abstractText);
        copy.setKeywords(keywords == null ? new ArrayList<>() : new ArrayList<>(keywords));
        copy.setCitationCount(citationCount);
        copy.setCitationText(citationText);
        copy.setTextPath(textPath);
        copy.setCreatedAt(createdAt);
        copy.setModifiedAt(modifiedAt);
        return copy;
    }
}
