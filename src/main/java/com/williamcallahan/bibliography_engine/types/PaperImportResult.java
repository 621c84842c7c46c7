package com.williamcallahan.bibliography_engine.types;

import com.williamcallahan.bibliography_engine.model.Paper;

/**
 * Library paper an import resolved to, whether it was created by the import,
 * and how many cached graph edges were pointed at it afterwards.
 */
public record PaperImportResult(Paper paper, boolean created, int linkedEdges) {
}
