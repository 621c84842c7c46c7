package com.williamcallahan.bibliography_engine.types;

/**
 * What a bibliographic source can supply for a paper it knows about.
 */
public record SourceCapabilities(boolean references, boolean citations, boolean pdf, boolean bibtex) {

    public static final SourceCapabilities NONE = new SourceCapabilities(false, false, false, false);
}
