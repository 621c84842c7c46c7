/**
 * Converts between typed paper records and the flat field maps the merge engine works on
 *
 * @author William Callahan
 *
 * Features:
 * - One shared key set for local papers and remote metadata
 * - Only non-null fields are emitted, so absent keys stay absent
 * - Applies merged values back onto a Paper without touching its id or timestamps
 */
package com.williamcallahan.bibliography_engine.mapper;

import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PaperFieldMapper {

    public static final String BIBCODE = "bibcode";
    public static final String DOI = "doi";
    public static final String ARXIV_ID = "arxivId";
    public static final String TITLE = "title";
    public static final String AUTHORS = "authors";
    public static final String YEAR = "year";
    public static final String JOURNAL = "journal";
    public static final String ABSTRACT = "abstract";
    public static final String KEYWORDS = "keywords";
    public static final String CITATION_COUNT = "citationCount";

    private PaperFieldMapper() {
    }

    public static Map<String, Object> toFieldMap(Paper paper) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (paper == null) {
            return fields;
        }
        put(fields, BIBCODE, paper.getBibcode());
        put(fields, DOI, paper.getDoi());
        put(fields, ARXIV_ID, paper.getArxivId());
        put(fields, TITLE, paper.getTitle());
        put(fields, AUTHORS, paper.getAuthors());
        put(fields, YEAR, paper.getYear());
        put(fields, JOURNAL, paper.getJournal());
        put(fields, ABSTRACT, paper.getAbstractText());
        put(fields, KEYWORDS, paper.getKeywords());
        put(fields, CITATION_COUNT, paper.getCitationCount());
        return fields;
    }

    public static Map<String, Object> toFieldMap(PaperMetadata metadata) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (metadata == null) {
            return fields;
        }
        put(fields, BIBCODE, metadata.getBibcode());
        put(fields, DOI, metadata.getDoi());
        put(fields, ARXIV_ID, metadata.getArxivId());
        put(fields, TITLE, metadata.getTitle());
        put(fields, AUTHORS, metadata.getAuthors());
        put(fields, YEAR, metadata.getYear());
        put(fields, JOURNAL, metadata.getJournal());
        put(fields, ABSTRACT, metadata.getAbstractText());
        put(fields, KEYWORDS, metadata.getKeywords());
        put(fields, CITATION_COUNT, metadata.getCitationCount());
        return fields;
    }

    /**
     * Writes every known key of {@code fields} onto the paper. Keys missing from the map leave
     * the corresponding property untouched.
     */
    public static void applyFieldMap(Paper paper, Map<String, Object> fields) {
        if (fields.containsKey(BIBCODE)) paper.setBibcode(asString(fields.get(BIBCODE)));
        if (fields.containsKey(DOI)) paper.setDoi(asString(fields.get(DOI)));
        if (fields.containsKey(ARXIV_ID)) paper.setArxivId(asString(fields.get(ARXIV_ID)));
        if (fields.containsKey(TITLE)) paper.setTitle(asString(fields.get(TITLE)));
        if (fields.containsKey(AUTHORS)) paper.setAuthors(asStringList(fields.get(AUTHORS)));
        if (fields.containsKey(YEAR)) paper.setYear(asInteger(fields.get(YEAR)));
        if (fields.containsKey(JOURNAL)) paper.setJournal(asString(fields.get(JOURNAL)));
        if (fields.containsKey(ABSTRACT)) paper.setAbstractText(asString(fields.get(ABSTRACT)));
        if (fields.containsKey(KEYWORDS)) paper.setKeywords(asStringList(fields.get(KEYWORDS)));
        if (fields.containsKey(CITATION_COUNT)) paper.setCitationCount(asInteger(fields.get(CITATION_COUNT)));
    }

    private static void put(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }
}
