package com.williamcallahan.bibliography_engine.repository;

import com.williamcallahan.bibliography_engine.types.CitationDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Back-filling linked paper ids on cached edges.
 */
@ExtendWith(MockitoExtension.class)
class JdbcCitationCacheRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JdbcCitationCacheRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcCitationCacheRepository(jdbcTemplate, new TransactionTemplate(transactionManager));
    }

    @Test
    void linkMatchingEdges_usesOneStatementForEveryIdentifier() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);

        int linked = repository.linkMatchingEdges(CitationDirection.REFERENCES, 7L,
            "10.1103/PhysRevLett.116.061102", "arXiv:1602.03837v2", "2016PhRvL.116f1102A");

        assertThat(linked).isEqualTo(1);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate, times(1)).update(sql.capture(), args.capture());
        assertThat(sql.getValue())
            .startsWith("UPDATE paper_references SET linked_paper_id = ? WHERE ")
            .contains("lower(target_doi) = ? OR ")
            .contains("target_bibcode = ?");
        assertThat(args.getValue()).containsExactly(7L, "10.1103/physrevlett.116.061102", "1602.03837", "2016PhRvL.116f1102A");
    }

    @Test
    void linkMatchingEdges_onlyIncludesPresentIdentifiers() {
        repository.linkMatchingEdges(CitationDirection.CITATIONS, 7L, null, null, "2016PhRvL.116f1102A");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).update(sql.capture(), args.capture());
        assertThat(sql.getValue()).isEqualTo("UPDATE paper_citations SET linked_paper_id = ? WHERE target_bibcode = ?");
        assertThat(args.getValue()).containsExactly(7L, "2016PhRvL.116f1102A");
    }

    @Test
    void linkMatchingEdges_withoutIdentifiersTouchesNothing() {
        assertThat(repository.linkMatchingEdges(CitationDirection.REFERENCES, 7L, null, " ", "")).isZero();

        verifyNoInteractions(jdbcTemplate);
    }
}
