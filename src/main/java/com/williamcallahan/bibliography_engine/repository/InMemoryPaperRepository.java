/**
 * In-process implementation of PaperRepository for database-free execution
 *
 * @author William Callahan
 *
 * Features:
 * - Automatically activated when no database URL is configured
 * - Stores detached copies so callers never share mutable state with the store
 * - Buffers deferred writes until flush, mirroring the JDBC implementation
 */
package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryPaperRepository implements PaperRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPaperRepository.class);

    private final Map<Long, Paper> papers = new LinkedHashMap<>();
    private final Map<Long, Paper> pending = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger flushCount = new AtomicInteger();
    private final Clock clock;

    public InMemoryPaperRepository(Clock clock) {
        this.clock = clock;
        logger.info("No database URL provided. Using in-memory paper repository.");
    }

    @Override
    public synchronized Optional<Paper> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        Paper paper = pending.containsKey(id) ? pending.get(id) : papers.get(id);
        return Optional.ofNullable(paper).map(Paper::copy);
    }

    @Override
    public synchronized List<Paper> findAll() {
        List<Paper> result = new ArrayList<>();
        for (Long id : papers.keySet()) {
            findById(id).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public synchronized List<Paper> findAllByIds(Collection<Long> ids) {
        List<Paper> result = new ArrayList<>();
        if (ids == null) {
            return result;
        }
        for (Long id : ids) {
            findById(id).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public Optional<Paper> findByDoi(String doi) {
        String key = IdentifierUtils.normalizeDoi(doi);
        return key == null ? Optional.empty() : findFirst(p -> key.equals(IdentifierUtils.normalizeDoi(p.getDoi())));
    }

    @Override
    public Optional<Paper> findByArxivId(String arxivId) {
        String key = IdentifierUtils.normalizeArxivId(arxivId);
        return key == null ? Optional.empty() : findFirst(p -> key.equals(IdentifierUtils.normalizeArxivId(p.getArxivId())));
    }

    @Override
    public Optional<Paper> findByBibcode(String bibcode) {
        if (bibcode == null || bibcode.isBlank()) {
            return Optional.empty();
        }
        String key = bibcode.trim();
        return findFirst(p -> key.equals(p.getBibcode()));
    }

    private synchronized Optional<Paper> findFirst(Predicate<Paper> predicate) {
        return findAll().stream().filter(predicate).findFirst();
    }

    @Override
    public synchronized Paper add(Paper paper) {
        Objects.requireNonNull(paper, "paper");
        Paper stored = paper.copy();
        Instant now = clock.instant();
        stored.setId(sequence.incrementAndGet());
        stored.setCreatedAt(now);
        stored.setModifiedAt(now);
        papers.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public synchronized void update(Paper paper, boolean flush) {
        Objects.requireNonNull(paper, "paper");
        if (paper.getId() == null || !papers.containsKey(paper.getId())) {
            throw new IllegalArgumentException("Unknown paper id: " + paper.getId());
        }
        Paper stored = paper.copy();
        stored.setModifiedAt(clock.instant());
        pending.put(stored.getId(), stored);
        if (flush) {
            flush();
        }
    }

    @Override
    public synchronized void flush() {
        papers.putAll(pending);
        pending.clear();
        flushCount.incrementAndGet();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public int getFlushCount() {
        return flushCount.get();
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }
}
