package com.williamcallahan.bibliography_engine.service.inspire;

import com.williamcallahan.bibliography_engine.types.SearchQuery;
import com.williamcallahan.bibliography_engine.util.TextUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered INSPIRE query strategies for a heuristic lookup, most specific first.
 */
final class InspireSmartSearch {

    static final String SORT = "bestmatch";

    record Strategy(String name, String query, double minSimilarity) {
    }

    private InspireSmartSearch() {
    }

    static List<Strategy> strategies(SearchQuery query) {
        String title = ValidationUtils.hasText(query.getTitle()) ? TextUtils.toPhraseSafe(query.getTitle()) : null;
        String author = ValidationUtils.hasText(query.getFirstAuthor()) ? query.getFirstAuthor().trim() : null;
        Integer year = query.getYear();
        List<Strategy> strategies = new ArrayList<>();

        if (title != null && author != null && year != null) {
            strategies.add(new Strategy("title_author_year",
                "t \"" + title + "\" and a " + author + " and date " + year, 0.4));
        }
        if (title != null && title.length() > 10) {
            strategies.add(new Strategy("exact_title", "t \"" + title + "\"", 0.5));
        }
        if (author != null && year != null) {
            strategies.add(new Strategy("author_year", "a " + author + " and date " + year, 0.5));
        }
        return strategies;
    }
}
