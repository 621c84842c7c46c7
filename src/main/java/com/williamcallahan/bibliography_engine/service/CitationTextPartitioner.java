package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.util.ValidationUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a bulk BibTeX export back into one entry per requested bibcode.
 * An entry is matched by the bibcode in its {@code adsurl} field first, then by plain containment.
 */
public final class CitationTextPartitioner {

    private static final Pattern ENTRY_START = Pattern.compile("(?=@)");
    private static final Pattern ADS_URL_BIBCODE = Pattern.compile("adsurl\\s*=\\s*\\{[^}]*/abs/([^}/]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADS_URL = Pattern.compile("adsurl\\s*=\\s*\\{([^}]+)\\}", Pattern.CASE_INSENSITIVE);
    private static final Pattern ABS_PATH = Pattern.compile("/abs/([^/\\s&?]+)");

    private CitationTextPartitioner() {
    }

    /**
     * @param export concatenated BibTeX entries
     * @param bibcodes the bibcodes the export was requested for
     * @return entry text keyed by requested bibcode; bibcodes without an entry are absent
     */
    public static Map<String, String> partition(String export, Collection<String> bibcodes) {
        Map<String, String> byBibcode = new LinkedHashMap<>();
        if (!ValidationUtils.hasText(export) || bibcodes == null || bibcodes.isEmpty()) {
            return byBibcode;
        }
        List<String> requested = bibcodes.stream().filter(ValidationUtils::hasText).toList();
        for (String entry : ENTRY_START.split(export)) {
            if (entry.isBlank()) {
                continue;
            }
            String text = "@" + (entry.startsWith("@") ? entry.substring(1) : entry).trim();
            Matcher adsUrl = ADS_URL_BIBCODE.matcher(entry);
            if (adsUrl.find()) {
                String extracted = adsUrl.group(1).trim();
                String match = requested.stream()
                    .filter(b -> b.equals(extracted) || stripDots(b).equals(stripDots(extracted)))
                    .findFirst()
                    .orElse(null);
                if (match != null) {
                    byBibcode.put(match, text);
                    continue;
                }
            }
            for (String bibcode : requested) {
                if (entry.contains(bibcode) || entry.contains(stripDots(bibcode))) {
                    byBibcode.put(bibcode, text);
                    break;
                }
            }
        }
        return byBibcode;
    }

    /**
     * Bibcode named by the {@code adsurl} field of a stored citation text, if any.
     */
    public static String bibcodeFromCitationText(String citationText) {
        if (!ValidationUtils.hasText(citationText)) {
            return null;
        }
        Matcher url = ADS_URL.matcher(citationText);
        if (!url.find()) {
            return null;
        }
        Matcher abs = ABS_PATH.matcher(url.group(1));
        return abs.find() ? abs.group(1) : null;
    }

    private static String stripDots(String bibcode) {
        return bibcode.replace(".", "");
    }
}
