/**
 * Link between a canonical paper and one external source's record of it
 *
 * Features:
 * - Unique per (paper, source) and per (source, source-local id)
 * - Capability flags advertised by the source when the link was made
 * - Priority used to choose which source to ask for references and citations
 */
package com.williamcallahan.bibliography_engine.model;

import com.williamcallahan.bibliography_engine.types.SourceCapabilities;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class PaperSource {

    public static final int DEFAULT_PRIORITY = 50;

    private Long paperId;
    private String source;
    private String sourceId;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    @Builder.Default
    private SourceCapabilities capabilities = SourceCapabilities.NONE;
    @Builder.Default
    private int priority = DEFAULT_PRIORITY;
    private Instant lastSynced;
    private boolean primary;

    public boolean hasReferences() {
        return capabilities != null && capabilities.references();
    }

    public boolean hasCitations() {
        return capabilities != null && capabilities.citations();
    }
}
