package com.williamcallahan.bibliography_engine.types;

/**
 * Direction of a cached citation-graph edge relative to the owning paper.
 */
public enum CitationDirection {
    /** Works the paper cites (outbound) */
    REFERENCES("paper_references"),
    /** Works citing the paper (inbound) */
    CITATIONS("paper_citations");

    private final String tableName;

    CitationDirection(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
