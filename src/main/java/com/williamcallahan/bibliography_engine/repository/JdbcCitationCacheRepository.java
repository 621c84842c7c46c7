package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.JdbcUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Postgres-backed citation cache. Both directions share one column layout.
 */
@Slf4j
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcCitationCacheRepository implements CitationCacheRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcCitationCacheRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void replaceEdges(CitationDirection direction, Long paperId, List<CitationEdge> edges) {
        String table = direction.getTableName();
        transactionTemplate.executeWithoutResult(status -> {
            int deleted = jdbcTemplate.update("DELETE FROM " + table + " WHERE paper_id = ?", paperId);
            if (!edges.isEmpty()) {
                jdbcTemplate.batchUpdate("INSERT INTO " + table + """
                     (paper_id, target_doi, target_arxiv_id, target_bibcode, target_source_id, title, authors, year,
                      journal, citation_count, source_plugin, cached_at, linked_paper_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, edges, edges.size(), (ps, edge) -> {
                    ps.setLong(1, paperId);
                    ps.setString(2, edge.getDoi());
                    ps.setString(3, edge.getArxivId());
                    ps.setString(4, edge.getBibcode());
                    ps.setString(5, edge.getSourceRecordId());
                    ps.setString(6, edge.getTitle());
                    ps.setString(7, edge.getAuthors());
                    ps.setObject(8, edge.getYear());
                    ps.setString(9, edge.getJournal());
                    ps.setObject(10, edge.getCitationCount());
                    ps.setString(11, edge.getSourcePlugin());
                    ps.setTimestamp(12, JdbcUtils.toTimestamp(edge.getCachedAt()));
                    ps.setObject(13, edge.getLinkedPaperId());
                });
            }
            log.debug("Replaced {} cached {} row(s) with {} for paper {}", deleted, table, edges.size(), paperId);
        });
    }

    @Override
    public List<CitationEdge> findEdges(CitationDirection direction, Long paperId) {
        return jdbcTemplate.query("""
            SELECT id, paper_id, target_doi, target_arxiv_id, target_bibcode, target_source_id, title, authors, year,
                   journal, citation_count, source_plugin, cached_at, linked_paper_id
            FROM %s
            WHERE paper_id = ?
            ORDER BY year DESC NULLS LAST, id
            """.formatted(direction.getTableName()), edgeRowMapper(), paperId);
    }

    @Override
    public int linkMatchingEdges(CitationDirection direction, Long linkedPaperId, String doi, String arxivId, String bibcode) {
        List<String> predicates = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        args.add(linkedPaperId);
        String doiKey = IdentifierUtils.normalizeDoi(doi);
        if (doiKey != null) {
            predicates.add("lower(target_doi) = ?");
            args.add(doiKey);
        }
        String arxivKey = IdentifierUtils.normalizeArxivId(arxivId);
        if (arxivKey != null) {
            predicates.add("lower(regexp_replace(regexp_replace(target_arxiv_id, '^arxiv:', '', 'i'), 'v[0-9]+$', '', 'i')) = ?");
            args.add(arxivKey);
        }
        if (bibcode != null && !bibcode.isBlank()) {
            predicates.add("target_bibcode = ?");
            args.add(bibcode);
        }
        if (predicates.isEmpty()) {
            return 0;
        }
        // one statement so an edge matching several identifiers counts once
        return jdbcTemplate.update("UPDATE " + direction.getTableName() + " SET linked_paper_id = ? WHERE "
            + String.join(" OR ", predicates), args.toArray());
    }

    private RowMapper<CitationEdge> edgeRowMapper() {
        return (rs, rowNum) -> CitationEdge.builder()
            .id(rs.getLong("id"))
            .paperId(rs.getLong("paper_id"))
            .doi(rs.getString("target_doi"))
            .arxivId(rs.getString("target_arxiv_id"))
            .bibcode(rs.getString("target_bibcode"))
            .sourceRecordId(rs.getString("target_source_id"))
            .title(rs.getString("title"))
            .authors(rs.getString("authors"))
            .year(JdbcUtils.getNullableInt(rs, "year"))
            .journal(rs.getString("journal"))
            .citationCount(JdbcUtils.getNullableInt(rs, "citation_count"))
            .sourcePlugin(rs.getString("source_plugin"))
            .cachedAt(JdbcUtils.getInstant(rs, "cached_at"))
            .linkedPaperId(JdbcUtils.getNullableLong(rs, "linked_paper_id"))
            .build();
    }
}
