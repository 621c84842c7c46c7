package com.williamcallahan.bibliography_engine.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Utility class for title and author-name handling used by heuristic matching.
 * Provides consistent text handling across the application.
 */
public class TextUtils {

    // Words too common in scholarly titles to carry matching signal
    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "with", "from", "that", "this", "have", "been",
        "were", "their", "which", "through", "about", "into", "using", "based"
    );

    private TextUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Jaccard similarity between the significant word sets of two titles.
     * Words of two characters or fewer and stop words are ignored.
     *
     * @param first a title
     * @param second another title
     * @return similarity in [0, 1]; 0 when either title is blank
     */
    public static double titleSimilarity(String first, String second) {
        if (!ValidationUtils.hasText(first) || !ValidationUtils.hasText(second)) {
            return 0;
        }
        Set<String> left = significantWords(first, 2);
        Set<String> right = significantWords(second, 2);
        if (left.isEmpty() || right.isEmpty()) {
            return 0;
        }
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        long shared = left.stream().filter(right::contains).count();
        return (double) shared / union.size();
    }

    /**
     * Lower-cased words longer than {@code minLengthExclusive} characters with stop words removed,
     * in order of first appearance.
     */
    public static Set<String> significantWords(String text, int minLengthExclusive) {
        if (!ValidationUtils.hasText(text)) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", " ").split("\\s+"))
            .filter(word -> word.length() > minLengthExclusive)
            .filter(word -> !STOP_WORDS.contains(word))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Surname of the first author. Author lists joined by " and " or ";" are split first;
     * "Surname, Given" yields the token before the comma, otherwise the last whitespace token.
     */
    public static String firstAuthorSurname(List<String> authors) {
        if (authors == null || authors.isEmpty()) {
            return null;
        }
        String first = authors.get(0);
        if (!ValidationUtils.hasText(first)) {
            return null;
        }
        String author = first.split("\\s+and\\s+|;")[0].trim();
        if (author.contains(",")) {
            String surname = author.substring(0, author.indexOf(',')).trim();
            return surname.isEmpty() ? null : surname;
        }
        String[] tokens = author.split("\\s+");
        return tokens[tokens.length - 1];
    }

    /**
     * Collapses characters that break phrase queries (quotes, colons, semicolons) into spaces.
     */
    public static String toPhraseSafe(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("[\"']", "").replaceAll("[:;]", " ").replaceAll("\\s+", " ").trim();
    }
}
