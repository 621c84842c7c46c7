package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;

/**
 * One pass over a text header looking for a single kind of identifier.
 */
@FunctionalInterface
public interface IdentifierStrategy {

    /**
     * @param header leading portion of the text
     * @return identifiers found by this strategy, {@link PaperIdentifiers#none()} when nothing matched
     */
    PaperIdentifiers extract(String header);
}
