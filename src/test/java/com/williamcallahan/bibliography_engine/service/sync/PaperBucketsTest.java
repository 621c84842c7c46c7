package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.model.Paper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaperBucketsTest {

    private static Paper paper(long id, String bibcode, String doi, String arxivId) {
        Paper paper = new Paper(id, "Paper " + id);
        paper.setBibcode(bibcode);
        paper.setDoi(doi);
        paper.setArxivId(arxivId);
        return paper;
    }

    @Test
    void partition_isDisjointAndBibcodeWins() {
        List<Paper> papers = List.of(
            paper(1, "2016PhRvL.116f1102A", "10.1103/x", "1602.03837"),
            paper(2, null, "10.1000/y", null),
            paper(3, null, null, "2101.01234"),
            paper(4, "  ", "", null),
            paper(5, null, null, null));

        PaperBuckets buckets = PaperBuckets.partition(papers);

        assertEquals(List.of(1L), buckets.withBibcode().stream().map(Paper::getId).toList());
        assertEquals(List.of(2L, 3L), buckets.withIdentifier().stream().map(Paper::getId).toList());
        assertEquals(List.of(4L, 5L), buckets.withoutIdentifier().stream().map(Paper::getId).toList());
        assertEquals(5, buckets.total());
    }

    @Test
    void partition_emptyInput() {
        assertEquals(0, PaperBuckets.partition(List.of()).total());
    }
}
