package com.williamcallahan.bibliography_engine.service.lookup;

import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import com.williamcallahan.bibliography_engine.util.TextUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores heuristic search results against the query that produced them. Shared by every source's smart search.
 */
public final class SearchCandidates {

    /** Similarity at which an author and year match confirms a weak title match */
    public static final double CONFIRMED_MIN_SIMILARITY = 0.25;

    public record Candidate(PaperMetadata metadata, double similarity, boolean authorMatch, boolean yearMatch) {
    }

    private SearchCandidates() {
    }

    /**
     * Best-scoring candidate if it reaches {@code minSimilarity}, or if author and year both match
     * and it reaches {@link #CONFIRMED_MIN_SIMILARITY}. Ties on similarity keep the remote ranking order.
     */
    public static Optional<Candidate> selectBest(SearchQuery query, List<PaperMetadata> docs, double minSimilarity) {
        if (docs == null || docs.isEmpty()) {
            return Optional.empty();
        }
        Candidate best = docs.stream()
            .map(doc -> score(query, doc))
            .sorted(Comparator.comparingDouble(Candidate::similarity).reversed())
            .findFirst()
            .orElseThrow();
        if (best.similarity() >= minSimilarity) {
            return Optional.of(best);
        }
        if (best.authorMatch() && best.yearMatch() && best.similarity() >= CONFIRMED_MIN_SIMILARITY) {
            return Optional.of(best);
        }
        return Optional.empty();
    }

    public static Candidate score(SearchQuery query, PaperMetadata doc) {
        double similarity = TextUtils.titleSimilarity(query.getTitle(), doc.getTitle());
        boolean authorMatch = false;
        if (ValidationUtils.hasText(query.getFirstAuthor()) && doc.getAuthors() != null && !doc.getAuthors().isEmpty()) {
            String firstDocAuthor = doc.getAuthors().get(0);
            authorMatch = firstDocAuthor != null && firstDocAuthor.toLowerCase(Locale.ROOT)
                .contains(query.getFirstAuthor().trim().toLowerCase(Locale.ROOT));
        }
        boolean yearMatch = query.getYear() != null && query.getYear().equals(doc.getYear());
        return new Candidate(doc, similarity, authorMatch, yearMatch);
    }
}
