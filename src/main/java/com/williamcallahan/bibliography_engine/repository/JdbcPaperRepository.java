/**
 * Postgres-backed implementation of PaperRepository
 *
 * @author William Callahan
 *
 * Features:
 * - Identifier lookups that mirror the unique indexes in db/schema.sql
 * - Deferred writes buffered in memory and written in one transaction on flush
 * - Reads overlay buffered writes so a run sees its own pending changes
 * - Author and keyword lists stored as JSONB
 */
package com.williamcallahan.bibliography_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.JdbcUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

@Slf4j
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcPaperRepository implements PaperRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT id, doi, arxiv_id, bibcode, title, authors::text AS authors, year, journal, abstract,
               keywords::text AS keywords, citation_count, citation_text, text_path, created_at, modified_at
        FROM papers
        """;

    private static final String NORMALIZED_ARXIV =
        "lower(regexp_replace(regexp_replace(arxiv_id, '^arxiv:', '', 'i'), 'v[0-9]+$', '', 'i'))";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<Long, Paper> pending = new LinkedHashMap<>();

    public JdbcPaperRepository(JdbcTemplate jdbcTemplate,
                               TransactionTemplate transactionTemplate,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<Paper> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        synchronized (pending) {
            if (pending.containsKey(id)) {
                return Optional.of(pending.get(id).copy());
            }
        }
        return JdbcUtils.queryForFirst(jdbcTemplate, SELECT_COLUMNS + " WHERE id = ?", paperRowMapper(), id);
    }

    @Override
    public List<Paper> findAll() {
        return overlay(jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", paperRowMapper()));
    }

    @Override
    public List<Paper> findAllByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Long[] idArray = ids.toArray(new Long[0]);
        List<Paper> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = ANY(?)",
            ps -> ps.setArray(1, ps.getConnection().createArrayOf("bigint", idArray)),
            paperRowMapper());
        Map<Long, Paper> byId = new LinkedHashMap<>();
        overlay(rows).forEach(paper -> byId.put(paper.getId(), paper));
        List<Paper> ordered = new ArrayList<>();
        for (Long id : ids) {
            Paper paper = byId.get(id);
            if (paper != null) {
                ordered.add(paper);
            }
        }
        return ordered;
    }

    @Override
    public Optional<Paper> findByDoi(String doi) {
        String key = IdentifierUtils.normalizeDoi(doi);
        if (key == null) {
            return Optional.empty();
        }
        return findWithPending(
            p -> key.equals(IdentifierUtils.normalizeDoi(p.getDoi())),
            SELECT_COLUMNS + " WHERE lower(doi) = ? ORDER BY id LIMIT 1", key);
    }

    @Override
    public Optional<Paper> findByArxivId(String arxivId) {
        String key = IdentifierUtils.normalizeArxivId(arxivId);
        if (key == null) {
            return Optional.empty();
        }
        return findWithPending(
            p -> key.equals(IdentifierUtils.normalizeArxivId(p.getArxivId())),
            SELECT_COLUMNS + " WHERE " + NORMALIZED_ARXIV + " = ? ORDER BY id LIMIT 1", key);
    }

    @Override
    public Optional<Paper> findByBibcode(String bibcode) {
        if (!ValidationUtils.hasText(bibcode)) {
            return Optional.empty();
        }
        String key = bibcode.trim();
        return findWithPending(
            p -> key.equals(p.getBibcode()),
            SELECT_COLUMNS + " WHERE bibcode = ? ORDER BY id LIMIT 1", key);
    }

    private Optional<Paper> findWithPending(Predicate<Paper> matcher, String sql, Object key) {
        synchronized (pending) {
            Optional<Paper> buffered = pending.values().stream().filter(matcher).findFirst();
            if (buffered.isPresent()) {
                return buffered.map(Paper::copy);
            }
        }
        Optional<Paper> stored = JdbcUtils.queryForFirst(jdbcTemplate, sql, paperRowMapper(), key);
        if (stored.isEmpty()) {
            return stored;
        }
        synchronized (pending) {
            Paper buffered = pending.get(stored.get().getId());
            if (buffered != null) {
                // The identifier was changed by a buffered write
                return matcher.test(buffered) ? Optional.of(buffered.copy()) : Optional.empty();
            }
        }
        return stored;
    }

    @Override
    public Paper add(Paper paper) {
        Objects.requireNonNull(paper, "paper");
        Instant now = clock.instant();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO papers (doi, arxiv_id, bibcode, title, authors, year, journal, abstract,
                                    keywords, citation_count, citation_text, text_path, created_at, modified_at)
                VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
                """, new String[] {"id"});
            bindPaper(ps, paper);
            ps.setTimestamp(13, JdbcUtils.toTimestamp(now));
            ps.setTimestamp(14, JdbcUtils.toTimestamp(now));
            return ps;
        }, keyHolder);

        Paper stored = paper.copy();
        Number key = keyHolder.getKey();
        stored.setId(key == null ? null : key.longValue());
        stored.setCreatedAt(now);
        stored.setModifiedAt(now);
        log.debug("Inserted paper {} ({})", stored.getId(), stored.getTitle());
        return stored;
    }

    @Override
    public void update(Paper paper, boolean flush) {
        Objects.requireNonNull(paper, "paper");
        if (paper.getId() == null) {
            throw new IllegalArgumentException("Cannot update a paper without an id");
        }
        Paper buffered = paper.copy();
        buffered.setModifiedAt(clock.instant());
        synchronized (pending) {
            pending.put(buffered.getId(), buffered);
        }
        if (flush) {
            flush();
        }
    }

    @Override
    public void flush() {
        List<Paper> batch;
        synchronized (pending) {
            if (pending.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(pending.values());
        }
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate("""
                UPDATE papers
                   SET doi = ?, arxiv_id = ?, bibcode = ?, title = ?, authors = ?::jsonb, year = ?, journal = ?,
                       abstract = ?, keywords = ?::jsonb, citation_count = ?, citation_text = ?, text_path = ?,
                       modified_at = ?
                 WHERE id = ?
                """, batch, batch.size(), (ps, paper) -> {
                bindPaper(ps, paper);
                ps.setTimestamp(13, JdbcUtils.toTimestamp(paper.getModifiedAt()));
                ps.setLong(14, paper.getId());
            }));
            log.info("Flushed {} buffered paper update(s)", batch.size());
        } finally {
            // Written or rolled back, the flushed copies leave; later writes to the same paper stay buffered
            synchronized (pending) {
                for (Paper written : batch) {
                    if (pending.get(written.getId()) == written) {
                        pending.remove(written.getId());
                    }
                }
            }
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Paper library database is unavailable: {}", e.getMessage());
            return false;
        }
    }

    int getPendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    private List<Paper> overlay(List<Paper> rows) {
        synchronized (pending) {
            if (pending.isEmpty()) {
                return rows;
            }
            List<Paper> result = new ArrayList<>(rows.size());
            for (Paper row : rows) {
                Paper buffered = pending.get(row.getId());
                result.add(buffered != null ? buffered.copy() : row);
            }
            return result;
        }
    }

    private void bindPaper(PreparedStatement ps, Paper paper) throws SQLException {
        ps.setString(1, paper.getDoi());
        ps.setString(2, paper.getArxivId());
        ps.setString(3, paper.getBibcode());
        ps.setString(4, paper.getTitle());
        ps.setString(5, writeList(paper.getAuthors()));
        ps.setObject(6, paper.getYear());
        ps.setString(7, paper.getJournal());
        ps.setString(8, paper.getAbstractText());
        ps.setString(9, writeList(paper.getKeywords()));
        ps.setObject(10, paper.getCitationCount());
        ps.setString(11, paper.getCitationText());
        ps.setString(12, paper.getTextPath());
    }

    private RowMapper<Paper> paperRowMapper() {
        return (rs, rowNum) -> mapPaper(rs);
    }

    private Paper mapPaper(ResultSet rs) throws SQLException {
        Paper paper = new Paper(rs.getLong("id"), rs.getString("title"));
        paper.setDoi(rs.getString("doi"));
        paper.setArxivId(rs.getString("arxiv_id"));
        paper.setBibcode(rs.getString("bibcode"));
        paper.setAuthors(readList(rs.getString("authors")));
        paper.setYear(JdbcUtils.getNullableInt(rs, "year"));
        paper.setJournal(rs.getString("journal"));
        paper.setAbstractText(rs.getString("abstract"));
        paper.setKeywords(readList(rs.getString("keywords")));
        paper.setCitationCount(JdbcUtils.getNullableInt(rs, "citation_count"));
        paper.setCitationText(rs.getString("citation_text"));
        paper.setTextPath(rs.getString("text_path"));
        paper.setCreatedAt(JdbcUtils.getInstant(rs, "created_at"));
        paper.setModifiedAt(JdbcUtils.getInstant(rs, "modified_at"));
        return paper;
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize string list", e);
        }
    }

    private List<String> readList(String json) {
        if (!ValidationUtils.hasText(json)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed JSON list column: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
    }
}
