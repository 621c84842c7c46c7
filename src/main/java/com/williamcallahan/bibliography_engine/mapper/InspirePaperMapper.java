/**
 * Maps INSPIRE HEP literature records into the canonical PaperMetadata shape
 *
 * @author William Callahan
 *
 * Features:
 * - Record id from the hit id, falling back to metadata.control_number
 * - Year from publication info, then preprint date, then earliest date
 * - ADS bibcode recovered from the external system identifiers
 * - Referenced record ids parsed from reference $ref links
 */
package com.williamcallahan.bibliography_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class InspirePaperMapper {

    private static final Pattern LITERATURE_REF = Pattern.compile("/literature/(\\d+)$");
    private static final Pattern YEAR_PREFIX = Pattern.compile("^(\\d{4})");

    private InspirePaperMapper() {
    }

    /**
     * @param hit one element of {@code hits.hits}, or the body of a single-record response
     * @return canonical metadata, or null for a missing node
     */
    public static PaperMetadata toPaperMetadata(JsonNode hit) {
        if (hit == null || hit.isMissingNode() || hit.isNull()) {
            return null;
        }
        JsonNode metadata = hit.path("metadata");
        JsonNode publicationInfo = metadata.path("publication_info").path(0);

        List<String> authors = new ArrayList<>();
        for (JsonNode author : metadata.path("authors")) {
            String name = text(author.path("full_name"));
            if (name != null) {
                authors.add(name);
            }
        }
        List<String> keywords = new ArrayList<>();
        for (JsonNode keyword : metadata.path("keywords")) {
            String value = text(keyword.path("value"));
            if (value != null) {
                keywords.add(value);
            }
        }

        return PaperMetadata.builder()
            .sourceRecordId(recid(hit))
            .bibcode(adsBibcode(metadata))
            .doi(text(metadata.path("dois").path(0).path("value")))
            .arxivId(text(metadata.path("arxiv_eprints").path(0).path("value")))
            .title(text(metadata.path("titles").path(0).path("title")))
            .authors(authors)
            .year(year(metadata, publicationInfo))
            .journal(ValidationUtils.firstNonBlank(
                text(publicationInfo.path("journal_title")),
                text(publicationInfo.path("pubinfo_freetext"))))
            .abstractText(text(metadata.path("abstracts").path(0).path("value")))
            .keywords(keywords)
            .citationCount(metadata.path("citation_count").isNumber() ? metadata.path("citation_count").asInt() : null)
            .build();
    }

    public static List<PaperMetadata> toPaperMetadataList(JsonNode hits) {
        List<PaperMetadata> result = new ArrayList<>();
        if (hits == null || !hits.isArray()) {
            return result;
        }
        for (JsonNode hit : hits) {
            PaperMetadata metadata = toPaperMetadata(hit);
            if (metadata != null && ValidationUtils.hasText(metadata.getSourceRecordId())) {
                result.add(metadata);
            }
        }
        return result;
    }

    /**
     * Record ids of the INSPIRE records this record references, in reference order without repeats.
     * References that were never matched to an INSPIRE record carry no link and are left out.
     */
    public static List<String> referenceRecids(JsonNode record) {
        Set<String> recids = new LinkedHashSet<>();
        if (record == null) {
            return List.of();
        }
        for (JsonNode reference : record.path("metadata").path("references")) {
            String ref = text(reference.path("record").path("$ref"));
            if (ref == null) {
                continue;
            }
            Matcher matcher = LITERATURE_REF.matcher(ref);
            if (matcher.find()) {
                recids.add(matcher.group(1));
            }
        }
        return new ArrayList<>(recids);
    }

    private static String recid(JsonNode hit) {
        String id = text(hit.path("id"));
        if (id != null) {
            return id;
        }
        return text(hit.path("metadata").path("control_number"));
    }

    private static String adsBibcode(JsonNode metadata) {
        for (JsonNode external : metadata.path("external_system_identifiers")) {
            if ("ADS".equalsIgnoreCase(external.path("schema").asText())) {
                return text(external.path("value"));
            }
        }
        return null;
    }

    private static Integer year(JsonNode metadata, JsonNode publicationInfo) {
        if (publicationInfo.path("year").isNumber()) {
            return publicationInfo.path("year").asInt();
        }
        Integer year = yearPrefix(text(publicationInfo.path("year")));
        if (year == null) {
            year = yearPrefix(text(metadata.path("preprint_date")));
        }
        if (year == null) {
            year = yearPrefix(text(metadata.path("earliest_date")));
        }
        return year;
    }

    private static Integer yearPrefix(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = YEAR_PREFIX.matcher(value);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return ValidationUtils.hasText(value) ? value.trim() : null;
    }
}
