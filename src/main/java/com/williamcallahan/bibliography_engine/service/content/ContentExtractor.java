package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.types.InferredMetadata;
import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;

/**
 * Best-effort extraction from a paper's raw full text.
 * Both operations return empty results rather than failing on unusable text.
 */
public interface ContentExtractor {

    PaperIdentifiers extractIdentifiers(String text);

    /**
     * Title, first-author surname and year guessed from the header area. DOI and arXiv fields stay null.
     */
    InferredMetadata extractMetadata(String text);
}
