/**
 * Ordered identifier strategies used to find a paper's remote record when the batch lookup cannot
 *
 * @author William Callahan
 *
 * Features:
 * - DOI fallback for batch misses
 * - DOI, then arXiv, then smart search for papers without a bibcode
 * - Citation-text URL, full-text identifiers, text heuristics and the optional inference assist
 *   for papers without any identifier
 * - Remote failures are remembered, never thrown; extraction failures count as "no data"
 */
package com.williamcallahan.bibliography_engine.service.sync;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.service.CitationTextPartitioner;
import com.williamcallahan.bibliography_engine.service.content.ContentExtractor;
import com.williamcallahan.bibliography_engine.service.content.FullTextStore;
import com.williamcallahan.bibliography_engine.service.content.MetadataInferenceAssist;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.types.InferredMetadata;
import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;
import com.williamcallahan.bibliography_engine.types.SearchQuery;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.IdentifierUtils;
import com.williamcallahan.bibliography_engine.util.TextUtils;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Component
public class PaperLookupChain {

    private final ContentExtractor contentExtractor;
    private final FullTextStore fullTextStore;
    private final ObjectProvider<MetadataInferenceAssist> inferenceAssist;
    private final AppConfigurationProperties properties;

    public PaperLookupChain(ContentExtractor contentExtractor,
                            FullTextStore fullTextStore,
                            ObjectProvider<MetadataInferenceAssist> inferenceAssist,
                            AppConfigurationProperties properties) {
        this.contentExtractor = contentExtractor;
        this.fullTextStore = fullTextStore;
        this.inferenceAssist = inferenceAssist;
        this.properties = properties;
    }

    /**
     * Individual DOI lookup for a paper whose bibcode was missing from the batch result
     */
    LookupResolution resolveByDoiFallback(Paper paper, BibliographicLookupClient client) {
        Attempts attempts = new Attempts(paper);
        if (!paper.hasDoi()) {
            log.info("[{}] No DOI available for fallback", paper.getBibcode());
            return LookupResolution.notFound(null);
        }
        String doi = IdentifierUtils.cleanDoi(paper.getDoi());
        Optional<PaperMetadata> match = attempts.lookup("doi-fallback", () -> client.getByDoi(doi));
        return match.map(found -> LookupResolution.found(found, "doi-fallback", PaperIdentifiers.none()))
            .orElseGet(attempts::notFound);
    }

    /**
     * DOI, then arXiv id, then smart search from the paper's own title, first author, year and journal
     */
    LookupResolution resolveByIdentifiers(Paper paper, BibliographicLookupClient client) {
        Attempts attempts = new Attempts(paper);
        if (paper.hasDoi()) {
            String doi = IdentifierUtils.cleanDoi(paper.getDoi());
            Optional<PaperMetadata> match = attempts.lookup("doi", () -> client.getByDoi(doi));
            if (match.isPresent()) {
                return LookupResolution.found(match.get(), "doi", PaperIdentifiers.none());
            }
        }
        if (paper.hasArxivId()) {
            Optional<PaperMetadata> match = attempts.lookup("arxiv", () -> client.getByArxiv(paper.getArxivId()));
            if (match.isPresent()) {
                return LookupResolution.found(match.get(), "arxiv", PaperIdentifiers.none());
            }
        }
        if (ValidationUtils.hasText(paper.getTitle())) {
            Optional<PaperMetadata> match = attempts.lookup("smart-search", () -> client.smartSearch(queryFor(paper)));
            if (match.isPresent()) {
                return LookupResolution.found(match.get(), "smart-search", PaperIdentifiers.none());
            }
        }
        return attempts.notFound();
    }

    /**
     * Full fallback chain for papers with no identifier at all
     */
    LookupResolution resolveWithoutIdentifiers(Paper paper, BibliographicLookupClient client) {
        Attempts attempts = new Attempts(paper);

        String urlBibcode = CitationTextPartitioner.bibcodeFromCitationText(paper.getCitationText());
        if (urlBibcode != null) {
            Optional<PaperMetadata> match = attempts.lookup("citation-url", () -> client.getByIdentifier(urlBibcode));
            if (match.isPresent()) {
                return LookupResolution.found(match.get(), "citation-url", PaperIdentifiers.builder().bibcode(urlBibcode).build());
            }
        }

        Optional<String> text = readText(paper);
        if (text.isPresent()) {
            PaperIdentifiers extracted = extractIdentifiers(paper, text.get());
            Optional<LookupResolution> byContent = lookupIdentifiers(attempts, client, extracted, "content");
            if (byContent.isPresent()) {
                return byContent.get();
            }

            InferredMetadata heuristic = extractMetadata(paper, text.get());
            InferredMetadata assisted = runAssist(paper, text.get());
            PaperIdentifiers assistIds = PaperIdentifiers.builder()
                .doi(assisted.getDoi())
                .arxivId(assisted.getArxivId())
                .build();
            Optional<LookupResolution> byAssist = lookupIdentifiers(attempts, client, assistIds, "assist");
            if (byAssist.isPresent()) {
                return byAssist.get();
            }

            String title = ValidationUtils.firstNonBlank(assisted.getTitle(), heuristic.getTitle());
            String author = ValidationUtils.firstNonBlank(assisted.getFirstAuthor(), heuristic.getFirstAuthor());
            if (ValidationUtils.hasText(title) || ValidationUtils.hasText(author)) {
                Integer year = assisted.getYear() != null ? assisted.getYear() : heuristic.getYear();
                SearchQuery query = SearchQuery.builder()
                    .title(ValidationUtils.firstNonBlank(title, paper.getTitle()))
                    .firstAuthor(author)
                    .year(year != null ? year : paper.getYear())
                    .journal(ValidationUtils.firstNonBlank(assisted.getJournal(), paper.getJournal()))
                    .build();
                Optional<PaperMetadata> match = attempts.lookup("text-search", () -> client.smartSearch(query));
                if (match.isPresent()) {
                    return LookupResolution.found(match.get(), "text-search", PaperIdentifiers.none());
                }
            }
        }

        if (ValidationUtils.hasText(paper.getTitle())) {
            Optional<PaperMetadata> match = attempts.lookup("smart-search", () -> client.smartSearch(queryFor(paper)));
            if (match.isPresent()) {
                return LookupResolution.found(match.get(), "smart-search", PaperIdentifiers.none());
            }
        }
        return attempts.notFound();
    }

    static SearchQuery queryFor(Paper paper) {
        return SearchQuery.builder()
            .title(paper.getTitle())
            .firstAuthor(TextUtils.firstAuthorSurname(paper.getAuthors()))
            .year(paper.getYear())
            .journal(paper.getJournal())
            .build();
    }

    // DOI, then arXiv, then bibcode; a DOI or arXiv hit is reported so it can be stored on the paper
    private Optional<LookupResolution> lookupIdentifiers(Attempts attempts, BibliographicLookupClient client,
                                                         PaperIdentifiers ids, String origin) {
        if (ValidationUtils.hasText(ids.getDoi())) {
            String doi = IdentifierUtils.cleanDoi(ids.getDoi());
            Optional<PaperMetadata> match = attempts.lookup(origin + "-doi", () -> client.getByDoi(doi));
            if (match.isPresent()) {
                return Optional.of(LookupResolution.found(match.get(), origin + "-doi", PaperIdentifiers.builder().doi(doi).build()));
            }
        }
        if (ValidationUtils.hasText(ids.getArxivId())) {
            Optional<PaperMetadata> match = attempts.lookup(origin + "-arxiv", () -> client.getByArxiv(ids.getArxivId()));
            if (match.isPresent()) {
                return Optional.of(LookupResolution.found(match.get(), origin + "-arxiv",
                    PaperIdentifiers.builder().arxivId(ids.getArxivId()).build()));
            }
        }
        if (ValidationUtils.hasText(ids.getBibcode())) {
            Optional<PaperMetadata> match = attempts.lookup(origin + "-bibcode", () -> client.getByIdentifier(ids.getBibcode()));
            if (match.isPresent()) {
                return Optional.of(LookupResolution.found(match.get(), origin + "-bibcode", PaperIdentifiers.none()));
            }
        }
        return Optional.empty();
    }

    private Optional<String> readText(Paper paper) {
        try {
            return fullTextStore.readText(paper).filter(ValidationUtils::hasText);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not read full text: {}", paper.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private PaperIdentifiers extractIdentifiers(Paper paper, String text) {
        try {
            return contentExtractor.extractIdentifiers(text);
        } catch (RuntimeException e) {
            log.warn("[{}] Identifier extraction failed: {}", paper.getId(), e.getMessage());
            return PaperIdentifiers.none();
        }
    }

    private InferredMetadata extractMetadata(Paper paper, String text) {
        try {
            return contentExtractor.extractMetadata(text);
        } catch (RuntimeException e) {
            log.warn("[{}] Metadata extraction failed: {}", paper.getId(), e.getMessage());
            return InferredMetadata.none();
        }
    }

    private InferredMetadata runAssist(Paper paper, String text) {
        MetadataInferenceAssist assist = inferenceAssist.getIfAvailable();
        if (assist == null) {
            return InferredMetadata.none();
        }
        Duration timeout = properties.getSync().getAssistTimeout();
        try {
            boolean available = Boolean.TRUE.equals(assist.isAvailable()
                .onErrorReturn(false)
                .block(timeout));
            if (!available) {
                return InferredMetadata.none();
            }
            log.info("[{}] Using inference assist to extract metadata", paper.getId());
            return assist.inferMetadata(text)
                .blockOptional(timeout)
                .orElse(InferredMetadata.none());
        } catch (RuntimeException e) {
            log.warn("[{}] Inference assist failed: {}", paper.getId(), e.getMessage());
            return InferredMetadata.none();
        }
    }

    /**
     * Runs lookups for one paper and remembers the last remote failure.
     */
    private final class Attempts {
        private final Paper paper;
        private String lastRemoteError;
        private int attempted;
        private int failed;

        private Attempts(Paper paper) {
            this.paper = paper;
        }

        Optional<PaperMetadata> lookup(String strategy, Supplier<Mono<PaperMetadata>> call) {
            attempted++;
            try {
                Optional<PaperMetadata> found = call.get()
                    .blockOptional(properties.getSync().getLookupTimeout());
                if (found.isPresent()) {
                    log.info("[{}] Found via {}: {}", paper.getId(), strategy, found.get().getBibcode());
                }
                return found;
            } catch (RuntimeException e) {
                failed++;
                lastRemoteError = ErrorHandlingUtils.describe(e);
                log.warn("[{}] {} lookup failed: {}", paper.getId(), strategy, lastRemoteError);
                return Optional.empty();
            }
        }

        /**
         * A miss is a remote failure only when every attempted strategy failed; one clean "not found" makes it a skip.
         */
        LookupResolution notFound() {
            return LookupResolution.notFound(attempted > 0 && failed == attempted ? lastRemoteError : null);
        }
    }
}
