package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process citation cache, used when no database URL is configured.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryCitationCacheRepository implements CitationCacheRepository {

    private final Map<CitationDirection, List<CitationEdge>> tables = new EnumMap<>(CitationDirection.class);
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryCitationCacheRepository() {
        for (CitationDirection direction : CitationDirection.values()) {
            tables.put(direction, new ArrayList<>());
        }
    }

    @Override
    public synchronized void replaceEdges(CitationDirection direction, Long paperId, List<CitationEdge> edges) {
        List<CitationEdge> table = tables.get(direction);
        table.removeIf(edge -> Objects.equals(edge.getPaperId(), paperId));
        for (CitationEdge edge : edges) {
            table.add(edge.toBuilder().id(sequence.incrementAndGet()).paperId(paperId).build());
        }
    }

    @Override
    public synchronized List<CitationEdge> findEdges(CitationDirection direction, Long paperId) {
        return tables.get(direction).stream()
            .filter(edge -> Objects.equals(edge.getPaperId(), paperId))
            .sorted(Comparator.comparing(CitationEdge::getYear, Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
                .thenComparing(CitationEdge::getId))
            .map(edge -> edge.toBuilder().build())
            .toList();
    }

    @Override
    public synchronized int linkMatchingEdges(CitationDirection direction, Long linkedPaperId,
                                              String doi, String arxivId, String bibcode) {
        String doiKey = IdentifierUtils.normalizeDoi(doi);
        String arxivKey = IdentifierUtils.normalizeArxivId(arxivId);
        int updated = 0;
        for (CitationEdge edge : tables.get(direction)) {
            boolean matches = (doiKey != null && doiKey.equals(IdentifierUtils.normalizeDoi(edge.getDoi())))
                || (arxivKey != null && arxivKey.equals(IdentifierUtils.normalizeArxivId(edge.getArxivId())))
                || (bibcode != null && bibcode.equals(edge.getBibcode()));
            if (matches) {
                edge.setLinkedPaperId(linkedPaperId);
                updated++;
            }
        }
        return updated;
    }
}
