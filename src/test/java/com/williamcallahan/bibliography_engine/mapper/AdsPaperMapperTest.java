package com.williamcallahan.bibliography_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for mapping ADS search documents.
 */
class AdsPaperMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void toPaperMetadata_mapsMultiValuedFields() throws Exception {
        JsonNode doc = objectMapper.readTree("""
            {
              "bibcode": "2016PhRvL.116f1102A",
              "title": ["Observation of Gravitational Waves from a Binary Black Hole Merger", "Alt title"],
              "author": ["Abbott, B. P.", "Abbott, R."],
              "year": "2016",
              "doi": ["10.1103/PhysRevLett.116.061102"],
              "pub": "Physical Review Letters",
              "identifier": ["2016PhRvL.116f1102A", "arXiv:1602.03837", "10.1103/PhysRevLett.116.061102"],
              "keyword": ["gravitational waves"],
              "citation_count": 9000
            }
            """);

        PaperMetadata metadata = AdsPaperMapper.toPaperMetadata(doc);

        assertEquals("2016PhRvL.116f1102A", metadata.getBibcode());
        assertEquals("Observation of Gravitational Waves from a Binary Black Hole Merger", metadata.getTitle());
        assertEquals(List.of("Abbott, B. P.", "Abbott, R."), metadata.getAuthors());
        assertEquals(2016, metadata.getYear());
        assertEquals("10.1103/PhysRevLett.116.061102", metadata.getDoi());
        assertEquals("1602.03837", metadata.getArxivId());
        assertEquals("Physical Review Letters", metadata.getJournal());
        assertEquals(9000, metadata.getCitationCount());
    }

    @Test
    void toPaperMetadata_absentFieldsStayNullOrEmpty() throws Exception {
        PaperMetadata metadata = AdsPaperMapper.toPaperMetadata(objectMapper.readTree("{\"bibcode\":\"X\",\"year\":\"2023-01\"}"));

        assertNull(metadata.getTitle());
        assertNull(metadata.getDoi());
        assertNull(metadata.getArxivId());
        assertTrue(metadata.getAuthors().isEmpty());
        assertEquals(2023, metadata.getYear());
        assertNull(AdsPaperMapper.toPaperMetadata(null));
    }

    @Test
    void toPaperMetadataList_dropsDocsWithoutBibcode() throws Exception {
        List<PaperMetadata> records = AdsPaperMapper.toPaperMetadataList(
            objectMapper.readTree("[{\"bibcode\":\"A\"},{\"title\":[\"orphan\"]},{\"bibcode\":\"  \"}]"));

        assertEquals(1, records.size());
        assertTrue(AdsPaperMapper.toPaperMetadataList(objectMapper.readTree("{}")).isEmpty());
    }
}
