package com.williamcallahan.bibliography_engine.mapper;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;

import java.util.List;

/**
 * Builds unresolved cache edges from remote metadata. Authors are stored joined with "; ".
 */
public final class CitationEdgeMapper {

    private CitationEdgeMapper() {
    }

    public static CitationEdge fromMetadata(PaperMetadata metadata, String sourceRecordId) {
        return CitationEdge.builder()
            .doi(metadata.getDoi())
            .arxivId(metadata.getArxivId())
            .bibcode(metadata.getBibcode())
            .sourceRecordId(sourceRecordId)
            .title(metadata.getTitle())
            .authors(joinAuthors(metadata.getAuthors()))
            .year(metadata.getYear())
            .journal(metadata.getJournal())
            .citationCount(metadata.getCitationCount())
            .build();
    }

    public static List<CitationEdge> fromMetadata(List<PaperMetadata> records) {
        return records.stream().map(record -> fromMetadata(record, record.getSourceRecordId())).toList();
    }

    static String joinAuthors(List<String> authors) {
        return authors == null || authors.isEmpty() ? null : String.join("; ", authors);
    }
}
