package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.PaperSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-process paper-source links, used when no database URL is configured.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryPaperSourceRepository implements PaperSourceRepository {

    private final List<PaperSource> links = new ArrayList<>();

    @Override
    public synchronized void upsert(PaperSource link) {
        Objects.requireNonNull(link, "link");
        links.removeIf(existing ->
            (Objects.equals(existing.getPaperId(), link.getPaperId()) && Objects.equals(existing.getSource(), link.getSource()))
                || (Objects.equals(existing.getSource(), link.getSource()) && Objects.equals(existing.getSourceId(), link.getSourceId())));
        if (link.isPrimary()) {
            links.replaceAll(existing -> Objects.equals(existing.getPaperId(), link.getPaperId()) && existing.isPrimary()
                ? existing.toBuilder().primary(false).build()
                : existing);
        }
        links.add(copyOf(link));
    }

    @Override
    public synchronized List<PaperSource> findByPaperId(Long paperId) {
        return links.stream()
            .filter(link -> Objects.equals(link.getPaperId(), paperId))
            .sorted(Comparator.comparing(PaperSource::isPrimary).reversed()
                .thenComparing(PaperSource::getLastSynced, Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
            .map(InMemoryPaperSourceRepository::copyOf)
            .toList();
    }

    @Override
    public synchronized Optional<PaperSource> findBySourceId(String source, String sourceId) {
        return links.stream()
            .filter(link -> Objects.equals(link.getSource(), source) && Objects.equals(link.getSourceId(), sourceId))
            .findFirst()
            .map(InMemoryPaperSourceRepository::copyOf);
    }

    private static PaperSource copyOf(PaperSource link) {
        return link.toBuilder()
            .metadata(link.getMetadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(link.getMetadata()))
            .build();
    }
}
