package com.williamcallahan.bibliography_engine.types;

import com.williamcallahan.bibliography_engine.model.PaperMetadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records returned by a batch lookup, plus the requested keys whose chunk failed remotely
 * (key mapped to the failure message).
 */
public record BatchLookupResult(List<PaperMetadata> found, Map<String, String> failures) {

    public static BatchLookupResult empty() {
        return new BatchLookupResult(List.of(), Map.of());
    }

    public static BatchLookupResult failedAll(List<String> keys, String message) {
        Map<String, String> failures = new LinkedHashMap<>();
        keys.forEach(key -> failures.put(key, message));
        return new BatchLookupResult(List.of(), failures);
    }
}
