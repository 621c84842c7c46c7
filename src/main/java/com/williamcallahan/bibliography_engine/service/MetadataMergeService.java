/**
 * Field-level merge of remote metadata into local records
 *
 * @author William Callahan
 *
 * Features:
 * - Incoming values win only when they carry information
 * - Existing values survive empty or missing incoming values
 * - Shallow: nested values are replaced whole, never merged
 */

package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.mapper.PaperFieldMapper;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Service
public class MetadataMergeService {

    /**
     * Merges two flat records. For each key in either map: the incoming value if meaningful,
     * else the existing value if present; keys absent from both are omitted.
     * A non-empty existing value is never replaced by an empty one.
     *
     * @param existing current local values, may be null
     * @param incoming freshly fetched values, may be null
     * @return a new map; neither input is modified
     */
    public Map<String, Object> mergeMetadata(Map<String, Object> existing, Map<String, Object> incoming) {
        Map<String, Object> current = existing == null ? Map.of() : existing;
        Map<String, Object> fresh = incoming == null ? Map.of() : incoming;

        Set<String> keys = new LinkedHashSet<>(current.keySet());
        keys.addAll(fresh.keySet());

        Map<String, Object> merged = new LinkedHashMap<>();
        for (String key : keys) {
            Object incomingValue = fresh.get(key);
            if (ValidationUtils.isMeaningful(incomingValue)) {
                merged.put(key, incomingValue);
            } else if (current.containsKey(key)) {
                merged.put(key, current.get(key));
            }
        }
        return merged;
    }

    /**
     * Returns a copy of {@code paper} with {@code incoming} merged over its bibliographic fields.
     * Identity, timestamps, citation text and text path are carried over unchanged.
     */
    public Paper mergeInto(Paper paper, PaperMetadata incoming) {
        Map<String, Object> merged = mergeMetadata(PaperFieldMapper.toFieldMap(paper), PaperFieldMapper.toFieldMap(incoming));
        Paper result = paper.copy();
        PaperFieldMapper.applyFieldMap(result, merged);
        return result;
    }
}
