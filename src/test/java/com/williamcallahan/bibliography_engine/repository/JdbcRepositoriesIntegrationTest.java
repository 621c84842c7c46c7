package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperSource;
import com.williamcallahan.bibliography_engine.test.annotations.DbIntegrationTest;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Round trips through the Postgres repositories and db/schema.sql.
 */
@DbIntegrationTest
class JdbcRepositoriesIntegrationTest {

    @Autowired
    private PaperRepository paperRepository;

    @Autowired
    private PaperSourceRepository paperSourceRepository;

    @Autowired
    private CitationCacheRepository citationCacheRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Paper addPaper(String title, String doi, String arxivId, String bibcode) {
        Paper paper = new Paper(null, title);
        paper.setDoi(doi);
        paper.setArxivId(arxivId);
        paper.setBibcode(bibcode);
        paper.setAuthors(List.of("Abbott, B. P.", "Abbott, R."));
        return paperRepository.add(paper);
    }

    @Test
    void bufferedUpdateIsVisibleBeforeFlushAndPersistedAfter() {
        Paper paper = addPaper("Observation of Gravitational Waves", null, "1602.03837", null);
        paper.setBibcode("2016PhRvL.116f1102A");
        paper.setDoi("10.1103/PhysRevLett.116.061102");

        paperRepository.update(paper, false);

        assertThat(paperRepository.findByBibcode("2016PhRvL.116f1102A")).map(Paper::getId).contains(paper.getId());
        assertThat(jdbcTemplate.queryForObject("SELECT bibcode FROM papers WHERE id = ?", String.class, paper.getId())).isNull();

        paperRepository.flush();

        assertThat(jdbcTemplate.queryForObject("SELECT bibcode FROM papers WHERE id = ?", String.class, paper.getId()))
            .isEqualTo("2016PhRvL.116f1102A");
        Paper stored = paperRepository.findByDoi("10.1103/physrevlett.116.061102").orElseThrow();
        assertThat(stored.getAuthors()).containsExactly("Abbott, B. P.", "Abbott, R.");
        assertThat(paperRepository.findByArxivId("arXiv:1602.03837v1")).map(Paper::getId).contains(paper.getId());
    }

    @Test
    void primaryLinkDemotesPreviousPrimary() {
        Paper paper = addPaper("Linked paper", null, null, null);
        paperSourceRepository.upsert(PaperSource.builder()
            .paperId(paper.getId()).source("inspire").sourceId("1421100").priority(20)
            .lastSynced(Instant.parse("2024-03-01T12:00:00Z")).primary(true).build());
        paperSourceRepository.upsert(PaperSource.builder()
            .paperId(paper.getId()).source("ads").sourceId("2016PhRvL.116f1102A").priority(10)
            .metadata(Map.of("collection", "astronomy"))
            .lastSynced(Instant.parse("2024-03-02T12:00:00Z")).primary(true).build());

        List<PaperSource> links = paperSourceRepository.findByPaperId(paper.getId());

        assertThat(links).hasSize(2);
        assertThat(links).filteredOn(PaperSource::isPrimary).extracting(PaperSource::getSource).containsExactly("ads");
        assertThat(links.get(0).getMetadata()).containsEntry("collection", "astronomy");
    }

    @Test
    void malformedStoredMetadataReadsAsEmptyObject() {
        Paper paper = addPaper("Malformed metadata", null, null, null);
        paperSourceRepository.upsert(PaperSource.builder()
            .paperId(paper.getId()).source("ads").sourceId("2020ApJ...900....1A").build());
        jdbcTemplate.update("UPDATE paper_sources SET source_metadata = ? WHERE paper_id = ?", "{broken", paper.getId());

        assertThat(paperSourceRepository.findBySourceId("ads", "2020ApJ...900....1A"))
            .hasValueSatisfying(link -> assertThat(link.getMetadata()).isEmpty());
    }

    @Test
    void edgeMatchingSeveralIdentifiersIsCountedOnce() {
        Paper owner = addPaper("Owner", null, null, null);
        Paper target = addPaper("Target", "10.1103/PhysRevLett.116.061102", "1602.03837", "2016PhRvL.116f1102A");
        citationCacheRepository.replaceEdges(CitationDirection.REFERENCES, owner.getId(), List.of(CitationEdge.builder()
            .doi("10.1103/PHYSREVLETT.116.061102")
            .arxivId("arXiv:1602.03837v2")
            .bibcode("2016PhRvL.116f1102A")
            .title("Target")
            .sourcePlugin("ads")
            .cachedAt(Instant.parse("2024-03-01T12:00:00Z"))
            .build()));

        int linked = citationCacheRepository.linkMatchingEdges(CitationDirection.REFERENCES, target.getId(),
            target.getDoi(), target.getArxivId(), target.getBibcode());

        assertThat(linked).isEqualTo(1);
        assertThat(citationCacheRepository.findEdges(CitationDirection.REFERENCES, owner.getId()))
            .extracting(CitationEdge::getLinkedPaperId).containsExactly(target.getId());
    }

    @Test
    void flushRejectsSecondPaperWithSameDoi() {
        addPaper("Holder", "10.1000/shared", null, null);
        Paper other = addPaper("Other", null, null, null);
        other.setDoi("10.1000/SHARED");
        paperRepository.update(other, false);

        // Postgres aborts the surrounding test transaction here, so nothing may follow this assertion
        assertThatThrownBy(() -> paperRepository.flush()).isInstanceOf(DataIntegrityViolationException.class);
    }
}
