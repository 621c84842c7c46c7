package com.williamcallahan.bibliography_engine.types;

/**
 * Identity, capabilities and selection priority a source attaches to every link it creates.
 * Lower priority values are preferred.
 */
public record SourceDescriptor(String name, SourceCapabilities capabilities, int priority) {
}
