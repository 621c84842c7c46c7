package com.williamcallahan.bibliography_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.bibliography_engine.model.PaperSource;
import com.williamcallahan.bibliography_engine.types.SourceCapabilities;
import com.williamcallahan.bibliography_engine.util.JdbcUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Postgres-backed paper-source links. Stored metadata that fails to decode is read back as an empty map.
 */
@Slf4j
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcPaperSourceRepository implements PaperSourceRepository {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT paper_id, source, source_id, source_metadata, has_references, has_citations, has_pdf, has_bibtex,
               priority, last_synced, is_primary
        FROM paper_sources
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public JdbcPaperSourceRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void upsert(PaperSource link) {
        SourceCapabilities capabilities = link.getCapabilities() == null ? SourceCapabilities.NONE : link.getCapabilities();
        String metadataJson = writeMetadata(link.getMetadata());
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("""
                DELETE FROM paper_sources
                 WHERE (paper_id = ? AND source = ?)
                    OR (source = ? AND source_id = ?)
                """, link.getPaperId(), link.getSource(), link.getSource(), link.getSourceId());
            if (link.isPrimary()) {
                jdbcTemplate.update("UPDATE paper_sources SET is_primary = FALSE WHERE paper_id = ? AND is_primary",
                    link.getPaperId());
            }
            jdbcTemplate.update("""
                INSERT INTO paper_sources (paper_id, source, source_id, source_metadata, has_references, has_citations,
                                           has_pdf, has_bibtex, priority, last_synced, is_primary)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                link.getPaperId(), link.getSource(), link.getSourceId(), metadataJson,
                capabilities.references(), capabilities.citations(), capabilities.pdf(), capabilities.bibtex(),
                link.getPriority(), JdbcUtils.toTimestamp(link.getLastSynced()), link.isPrimary());
        });
    }

    @Override
    public List<PaperSource> findByPaperId(Long paperId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE paper_id = ? ORDER BY is_primary DESC, last_synced DESC NULLS LAST, id",
            rowMapper(), paperId);
    }

    @Override
    public Optional<PaperSource> findBySourceId(String source, String sourceId) {
        return JdbcUtils.queryForFirst(jdbcTemplate, SELECT_COLUMNS + " WHERE source = ? AND source_id = ?",
            rowMapper(), source, sourceId);
    }

    private RowMapper<PaperSource> rowMapper() {
        return (rs, rowNum) -> PaperSource.builder()
            .paperId(rs.getLong("paper_id"))
            .source(rs.getString("source"))
            .sourceId(rs.getString("source_id"))
            .metadata(readMetadata(rs.getString("source_metadata")))
            .capabilities(new SourceCapabilities(
                rs.getBoolean("has_references"),
                rs.getBoolean("has_citations"),
                rs.getBoolean("has_pdf"),
                rs.getBoolean("has_bibtex")))
            .priority(rs.getInt("priority"))
            .lastSynced(JdbcUtils.getInstant(rs, "last_synced"))
            .primary(rs.getBoolean("is_primary"))
            .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (ValidationUtils.isEmpty(metadata)) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Dropping source metadata that cannot be serialized: {}", e.getOriginalMessage());
            return null;
        }
    }

    Map<String, Object> readMetadata(String json) {
        if (!ValidationUtils.hasText(json)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> decoded = objectMapper.readValue(json, MAP_TYPE);
            return decoded == null ? new LinkedHashMap<>() : new LinkedHashMap<>(decoded);
        } catch (JsonProcessingException e) {
            log.debug("Malformed source metadata, using empty object: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }
}
