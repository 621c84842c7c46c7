package com.williamcallahan.bibliography_engine.service.ads;

import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.service.lookup.SearchCandidates;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import com.williamcallahan.bibliography_engine.util.TextUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the ordered ADS query strategies for a heuristic lookup and picks the accepted candidate.
 * Strategies run from most to least specific; the first accepted candidate wins.
 */
final class AdsSmartSearch {

    static final String SORT = "score desc";

    private static final Set<String> TITLE_STOP_WORDS = Set.of(
        "with", "from", "that", "this", "have", "been", "were", "their", "which", "through",
        "about", "using", "based", "study", "analysis", "observations", "properties"
    );

    record Strategy(String name, String query, double minSimilarity) {
    }

    private AdsSmartSearch() {
    }

    static List<Strategy> strategies(SearchQuery query) {
        String title = query.getTitle();
        String author = ValidationUtils.hasText(query.getFirstAuthor()) ? query.getFirstAuthor().trim() : null;
        Integer year = query.getYear();
        List<Strategy> strategies = new ArrayList<>();

        if (title != null && title.length() > 10) {
            strategies.add(new Strategy("exact_title", "title:\"" + TextUtils.toPhraseSafe(title) + "\"", 0.5));
        }

        if (ValidationUtils.hasText(title)) {
            List<String> words = titleWords(title).stream()
                .filter(word -> word.length() > 3)
                .filter(word -> !TITLE_STOP_WORDS.contains(word.toLowerCase(Locale.ROOT)))
                .limit(8)
                .toList();
            if (!words.isEmpty()) {
                StringBuilder q = new StringBuilder("title:(").append(String.join(" ", words)).append(')');
                if (author != null) {
                    q.append(" author:\"^").append(author).append('"');
                }
                if (year != null) {
                    q.append(" year:").append(year);
                }
                strategies.add(new Strategy("title_words_author_year", q.toString(), 0.4));
            }
        }

        if (author != null && year != null && ValidationUtils.hasText(title)) {
            String distinctive = joinWords(title, 5, 4);
            if (!distinctive.isEmpty()) {
                strategies.add(new Strategy("author_year_keywords",
                    "author:\"^" + author + "\" year:" + year + " title:(" + distinctive + ")", 0.35));
            }
        }

        if (author != null && year != null) {
            strategies.add(new Strategy("author_year_only", "author:\"^" + author + "\" year:" + year, 0.5));
        }

        if (title != null && title.length() > 20) {
            String important = joinWords(title, 4, 6);
            if (!important.isEmpty()) {
                strategies.add(new Strategy("title_words_only", "title:(" + important + ")", 0.55));
            }
        }
        return strategies;
    }

    /**
     * Best candidate for the strategy's threshold; see {@link SearchCandidates#selectBest}
     */
    static Optional<SearchCandidates.Candidate> selectBest(SearchQuery query, List<PaperMetadata> docs, Strategy strategy) {
        return SearchCandidates.selectBest(query, docs, strategy.minSimilarity());
    }

    private static List<String> titleWords(String title) {
        return Arrays.stream(title.replaceAll("[^\\w\\s]", " ").split("\\s+"))
            .filter(word -> !word.isEmpty())
            .toList();
    }

    private static String joinWords(String title, int minLengthExclusive, int limit) {
        return titleWords(title).stream()
            .filter(word -> word.length() > minLengthExclusive)
            .limit(limit)
            .collect(Collectors.joining(" "));
    }
}
