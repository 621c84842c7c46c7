package com.williamcallahan.bibliography_engine.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical, source-agnostic shape of a remote bibliographic record.
 * Every source adapter maps its own payload into this type before
 * deduplication or merging sees it.
 */
@Value
@Builder(toBuilder = true)
public class PaperMetadata {
    String bibcode;
    String doi;
    String arxivId;
    String title;
    List<String> authors;
    Integer year;
    String journal;
    String abstractText;
    List<String> keywords;
    Integer citationCount;
    /** Record id inside the source that produced this record, for sources not keyed by bibcode (INSPIRE recid) */
    String sourceRecordId;

    /**
     * The identifier this record is addressed by in its own source
     */
    public String recordKey() {
        return sourceRecordId != null && !sourceRecordId.isBlank() ? sourceRecordId : bibcode;
    }
}
