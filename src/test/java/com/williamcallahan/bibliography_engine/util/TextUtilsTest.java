package com.williamcallahan.bibliography_engine.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for title and author text helpers.
 */
public class TextUtilsTest {

    @Test
    void titleSimilarity_identicalTitlesScoreOne() {
        String title = "Gravitational waves from binary black hole mergers";
        assertEquals(1.0, TextUtils.titleSimilarity(title, title), 1e-9);
    }

    @Test
    void titleSimilarity_ignoresCasePunctuationAndStopWords() {
        double similarity = TextUtils.titleSimilarity(
            "The Dark Energy Survey: cosmology results",
            "dark energy survey cosmology results");
        assertEquals(1.0, similarity, 1e-9);
    }

    @Test
    void titleSimilarity_partialOverlapIsJaccard() {
        // {dark, matter, halos} vs {dark, matter, profiles}: 2 shared of 4
        assertEquals(0.5, TextUtils.titleSimilarity("Dark matter halos", "Dark matter profiles"), 1e-9);
    }

    @Test
    void titleSimilarity_blankInputScoresZero() {
        assertEquals(0.0, TextUtils.titleSimilarity(null, "anything"));
        assertEquals(0.0, TextUtils.titleSimilarity("an of", "an of"));
    }

    @Test
    void significantWords_keepsFirstAppearanceOrder() {
        Set<String> words = TextUtils.significantWords("Stellar winds and stellar mass loss", 3);
        assertEquals(List.of("stellar", "winds", "mass", "loss"), List.copyOf(words));
    }

    @Test
    void firstAuthorSurname_handlesCommaAndNaturalOrder() {
        assertEquals("Einstein", TextUtils.firstAuthorSurname(List.of("Einstein, A.", "Rosen, N.")));
        assertEquals("Hawking", TextUtils.firstAuthorSurname(List.of("Stephen W. Hawking")));
        assertEquals("Penrose", TextUtils.firstAuthorSurname(List.of("Roger Penrose and Stephen Hawking")));
        assertNull(TextUtils.firstAuthorSurname(List.of()));
        assertNull(TextUtils.firstAuthorSurname(null));
    }

    @Test
    void toPhraseSafe_removesQuotesAndSeparators() {
        assertEquals("Planck 2018 results VI. Cosmological parameters",
            TextUtils.toPhraseSafe("Planck 2018 results: \"VI. Cosmological parameters\""));
        assertEquals("", TextUtils.toPhraseSafe(null));
    }
}
