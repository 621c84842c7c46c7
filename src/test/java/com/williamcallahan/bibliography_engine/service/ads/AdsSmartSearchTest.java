package com.williamcallahan.bibliography_engine.service.ads;

import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.service.lookup.SearchCandidates;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ADS smart search strategy construction and candidate acceptance.
 */
class AdsSmartSearchTest {

    private static final SearchQuery FULL = SearchQuery.builder()
        .title("Observations of Dark Matter Halos in Dwarf Galaxies")
        .firstAuthor("Smith")
        .year(2019)
        .build();

    @Test
    void strategies_fullQueryRunsMostSpecificFirst() {
        List<AdsSmartSearch.Strategy> strategies = AdsSmartSearch.strategies(FULL);

        assertEquals(List.of("exact_title", "title_words_author_year", "author_year_keywords", "author_year_only", "title_words_only"),
            strategies.stream().map(AdsSmartSearch.Strategy::name).toList());
        assertEquals("title:\"Observations of Dark Matter Halos in Dwarf Galaxies\"", strategies.get(0).query());
        assertEquals("title:(Dark Matter Halos Dwarf Galaxies) author:\"^Smith\" year:2019", strategies.get(1).query());
        assertEquals("author:\"^Smith\" year:2019 title:(Observations Matter Galaxies)", strategies.get(2).query());
        assertEquals("author:\"^Smith\" year:2019", strategies.get(3).query());
        assertEquals(0.55, strategies.get(4).minSimilarity());
    }

    @Test
    void strategies_authorAndYearOnly() {
        List<AdsSmartSearch.Strategy> strategies = AdsSmartSearch.strategies(
            SearchQuery.builder().firstAuthor("Hubble").year(1929).build());

        assertEquals(1, strategies.size());
        assertEquals("author_year_only", strategies.get(0).name());
    }

    @Test
    void strategies_shortTitleSkipsExactPhrase() {
        List<AdsSmartSearch.Strategy> strategies = AdsSmartSearch.strategies(SearchQuery.builder().title("Pulsars").build());

        assertEquals(List.of("title_words_author_year"), strategies.stream().map(AdsSmartSearch.Strategy::name).toList());
        assertEquals("title:(Pulsars)", strategies.get(0).query());
    }

    @Test
    void selectBest_picksHighestSimilarityAboveThreshold() {
        AdsSmartSearch.Strategy strategy = new AdsSmartSearch.Strategy("exact_title", "q", 0.5);
        PaperMetadata weak = PaperMetadata.builder().bibcode("weak").title("Unrelated stellar spectra").build();
        PaperMetadata strong = PaperMetadata.builder().bibcode("strong").title("Dark Matter Halos in Dwarf Galaxies").build();

        SearchCandidates.Candidate best = AdsSmartSearch.selectBest(FULL, List.of(weak, strong), strategy).orElseThrow();

        assertEquals("strong", best.metadata().getBibcode());
        assertTrue(best.similarity() >= 0.5);
    }

    @Test
    void selectBest_authorAndYearConfirmWeakTitleMatch() {
        AdsSmartSearch.Strategy strategy = new AdsSmartSearch.Strategy("author_year_only", "q", 0.5);
        // {dark, matter, halos, dwarf, galaxies, observations} vs {dark, matter, halos, clusters}: 3 of 7
        PaperMetadata doc = PaperMetadata.builder()
            .bibcode("confirmed")
            .title("Dark matter halos in clusters")
            .authors(List.of("Smith, Jane"))
            .year(2019)
            .build();

        assertTrue(AdsSmartSearch.selectBest(FULL, List.of(doc), strategy).isPresent());
        assertTrue(AdsSmartSearch.selectBest(FULL, List.of(doc.toBuilder().year(2018).build()), strategy).isEmpty());
    }

    @Test
    void selectBest_emptyDocs() {
        assertTrue(AdsSmartSearch.selectBest(FULL, List.of(), new AdsSmartSearch.Strategy("x", "q", 0.1)).isEmpty());
    }
}
