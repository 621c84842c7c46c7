package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.model.Paper;

import java.util.ArrayList;
import java.util.List;

/**
 * Disjoint partition of a run's papers by the identifiers they already carry.
 *
 * @param withBibcode papers resolved by one batch bibcode lookup
 * @param withIdentifier papers with a DOI or arXiv id but no bibcode
 * @param withoutIdentifier papers with none of the three identifiers
 */
public record PaperBuckets(List<Paper> withBibcode, List<Paper> withIdentifier, List<Paper> withoutIdentifier) {

    public static PaperBuckets partition(List<Paper> papers) {
        List<Paper> withBibcode = new ArrayList<>();
        List<Paper> withIdentifier = new ArrayList<>();
        List<Paper> withoutIdentifier = new ArrayList<>();
        for (Paper paper : papers) {
            if (paper.hasBibcode()) {
                withBibcode.add(paper);
            } else if (paper.hasDoi() || paper.hasArxivId()) {
                withIdentifier.add(paper);
            } else {
                withoutIdentifier.add(paper);
            }
        }
        return new PaperBuckets(List.copyOf(withBibcode), List.copyOf(withIdentifier), List.copyOf(withoutIdentifier));
    }

    public int total() {
        return withBibcode.size() + withIdentifier.size() + withoutIdentifier.size();
    }
}
