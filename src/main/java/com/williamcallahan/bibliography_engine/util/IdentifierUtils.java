/**
 * Identifier cleaning and normalization for DOIs, arXiv ids and bibcodes
 *
 * @author William Callahan
 *
 * Features:
 * - Strips resolver prefixes and landing-page garbage from DOIs
 * - Recognizes new-style and old-style arXiv identifiers in identifier lists
 * - Produces comparison keys used by deduplication and cache linking
 */

package com.williamcallahan.bibliography_engine.util;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class IdentifierUtils {

    private static final Pattern DOI_RESOLVER_PREFIX = Pattern.compile("^https?://(dx\\.)?doi\\.org/", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI_SCHEME_PREFIX = Pattern.compile("^doi:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI_PAGE_SUFFIX = Pattern.compile("/(CITE/REFWORKS|abstract|full|pdf)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI_ASSET_PATH = Pattern.compile("/ASSET/.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI_NUMBERED_IMAGE = Pattern.compile("/\\d+/[^/]*\\.(gif|jpeg|jpg|png|svg|webp)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI_IMAGE = Pattern.compile("/[^/]*\\.(gif|jpeg|jpg|png|svg|webp)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern ARXIV_PREFIX = Pattern.compile("^arxiv:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARXIV_VERSION = Pattern.compile("v\\d+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARXIV_NEW_STYLE = Pattern.compile("^(?:arxiv:)?(\\d{4}\\.\\d{4,5}(?:v\\d+)?)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARXIV_OLD_STYLE = Pattern.compile("^(?:arxiv:)?([a-z-]+(?:\\.[a-z]{2})?/\\d{7}(?:v\\d+)?)$", Pattern.CASE_INSENSITIVE);

    private IdentifierUtils() {
    }

    /**
     * Cleans a raw DOI string. Never fails; null input yields an empty string.
     * Applying the result to this method again returns the same value.
     *
     * @param raw DOI as found in a record, URL or citation
     * @return the bare DOI
     */
    public static String cleanDoi(String raw) {
        if (raw == null) {
            return "";
        }
        String current = raw.trim();
        // Suffix stripping can expose another strippable suffix, so run to a fixed point
        while (true) {
            String next = cleanDoiOnce(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    private static String cleanDoiOnce(String value) {
        String result = DOI_RESOLVER_PREFIX.matcher(value).replaceFirst("");
        result = DOI_SCHEME_PREFIX.matcher(result).replaceFirst("");
        result = DOI_PAGE_SUFFIX.matcher(result).replaceFirst("");
        result = DOI_ASSET_PATH.matcher(result).replaceFirst("");
        result = DOI_NUMBERED_IMAGE.matcher(result).replaceFirst("");
        result = DOI_IMAGE.matcher(result).replaceFirst("");
        return result.trim();
    }

    /**
     * Returns the first arXiv id found in the identifier list, in input order.
     *
     * @param identifiers identifiers as reported by a bibliographic source
     * @return the arXiv id without any {@code arXiv:} prefix, version kept
     */
    public static Optional<String> extractArxivId(List<String> identifiers) {
        if (identifiers == null) {
            return Optional.empty();
        }
        for (String identifier : identifiers) {
            if (identifier == null) {
                continue;
            }
            String candidate = identifier.trim();
            Matcher newStyle = ARXIV_NEW_STYLE.matcher(candidate);
            if (newStyle.matches()) {
                return Optional.of(newStyle.group(1));
            }
            Matcher oldStyle = ARXIV_OLD_STYLE.matcher(candidate);
            if (oldStyle.matches()) {
                return Optional.of(oldStyle.group(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Comparison key for arXiv ids: prefix and version removed, lower-cased.
     */
    public static String normalizeArxivId(String arxivId) {
        if (!ValidationUtils.hasText(arxivId)) {
            return null;
        }
        String stripped = ARXIV_PREFIX.matcher(arxivId.trim()).replaceFirst("");
        stripped = ARXIV_VERSION.matcher(stripped).replaceFirst("");
        return stripped.toLowerCase(Locale.ROOT);
    }

    /**
     * Comparison key for DOIs. DOIs are case-insensitive.
     */
    public static String normalizeDoi(String doi) {
        if (!ValidationUtils.hasText(doi)) {
            return null;
        }
        String cleaned = cleanDoi(doi);
        return cleaned.isEmpty() ? null : cleaned.toLowerCase(Locale.ROOT);
    }

    /**
     * Punctuation-tolerant bibcode key: dots removed, lower-cased.
     * Used only when an exact bibcode comparison fails.
     */
    public static String normalizeBibcode(String bibcode) {
        if (!ValidationUtils.hasText(bibcode)) {
            return null;
        }
        return bibcode.trim().replace(".", "").toLowerCase(Locale.ROOT);
    }
}
