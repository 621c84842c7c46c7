/**
 * Maps NASA ADS search documents into the canonical PaperMetadata shape
 *
 * @author William Callahan
 *
 * Features:
 * - First DOI and first title of multi-valued ADS fields
 * - arXiv id recovered from the ADS identifier list
 * - Numeric year and citation count parsed leniently
 */
package com.williamcallahan.bibliography_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AdsPaperMapper {

    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\d+");

    private AdsPaperMapper() {
    }

    /**
     * @param doc one element of the ADS {@code response.docs} array
     * @return canonical metadata, or null for a missing node
     */
    public static PaperMetadata toPaperMetadata(JsonNode doc) {
        if (doc == null || doc.isMissingNode() || doc.isNull()) {
            return null;
        }
        List<String> identifiers = textList(doc.path("identifier"));
        return PaperMetadata.builder()
            .bibcode(text(doc.path("bibcode")))
            .doi(first(textList(doc.path("doi"))))
            .arxivId(IdentifierUtils.extractArxivId(identifiers).orElse(null))
            .title(first(textList(doc.path("title"))))
            .authors(textList(doc.path("author")))
            .year(integer(doc.path("year")))
            .journal(text(doc.path("pub")))
            .abstractText(text(doc.path("abstract")))
            .keywords(textList(doc.path("keyword")))
            .citationCount(integer(doc.path("citation_count")))
            .build();
    }

    public static List<PaperMetadata> toPaperMetadataList(JsonNode docs) {
        List<PaperMetadata> result = new ArrayList<>();
        if (docs == null || !docs.isArray()) {
            return result;
        }
        for (JsonNode doc : docs) {
            PaperMetadata metadata = toPaperMetadata(doc);
            if (metadata != null && ValidationUtils.hasText(metadata.getBibcode())) {
                result.add(metadata);
            }
        }
        return result;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return ValidationUtils.hasText(value) ? value.trim() : null;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = text(item);
                if (value != null) {
                    values.add(value);
                }
            }
        } else {
            String value = text(node);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private static String first(List<String> values) {
        return values.isEmpty() ? null : values.get(0);
    }

    private static Integer integer(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        // ADS years are strings; tolerate trailing qualifiers such as "2023-01"
        Matcher matcher = LEADING_DIGITS.matcher(node.asText().trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
