package com.williamcallahan.bibliography_engine.service.event;

/**
 * Event published when an import resolves a remote record to a library paper.
 */
public class PaperImportedEvent {
    private final Long paperId;
    private final String source;
    private final String sourceId;
    private final boolean isNew;
    private final int linkedEdges;

    public PaperImportedEvent(Long paperId, String source, String sourceId, boolean isNew, int linkedEdges) {
        this.paperId = paperId;
        this.source = source;
        this.sourceId = sourceId;
        this.isNew = isNew;
        this.linkedEdges = linkedEdges;
    }

    public Long getPaperId() { return paperId; }
    public String getSource() { return source; }
    public String getSourceId() { return sourceId; }
    public boolean isNew() { return isNew; }
    public int getLinkedEdges() { return linkedEdges; }
}
