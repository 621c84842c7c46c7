/**
 * Cache of reference and citation graph snapshots with a freshness window
 *
 * @author William Callahan
 *
 * Features:
 * - Whole-snapshot replacement per paper and direction; rows are never patched
 * - Resolves each edge to a local paper by DOI, then arXiv id, then bibcode
 * - Staleness computed from the snapshot's cached-at timestamp
 * - Retroactive linking when a paper joins the library after its citers were cached
 */

package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.repository.CitationCacheRepository;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.types.CachedCitationGraph;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class CitationCacheService {

    private final CitationCacheRepository citationCacheRepository;
    private final PaperRepository paperRepository;
    private final AppConfigurationProperties appProperties;
    private final Clock clock;

    public CitationCacheService(CitationCacheRepository citationCacheRepository,
                                PaperRepository paperRepository,
                                AppConfigurationProperties appProperties,
                                Clock clock) {
        this.citationCacheRepository = citationCacheRepository;
        this.paperRepository = paperRepository;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public void cacheReferences(Long paperId, List<CitationEdge> references, String sourcePlugin) {
        cacheEdges(CitationDirection.REFERENCES, paperId, references, sourcePlugin);
    }

    public void cacheCitations(Long paperId, List<CitationEdge> citations, String sourcePlugin) {
        cacheEdges(CitationDirection.CITATIONS, paperId, citations, sourcePlugin);
    }

    public CachedCitationGraph getCachedReferences(Long paperId) {
        return getCached(CitationDirection.REFERENCES, paperId);
    }

    public CachedCitationGraph getCachedCitations(Long paperId) {
        return getCached(CitationDirection.CITATIONS, paperId);
    }

    /**
     * Replaces the cached snapshot for one direction. Every stored edge gets the same
     * cached-at timestamp and source plugin.
     */
    public void cacheEdges(CitationDirection direction, Long paperId, List<CitationEdge> edges, String sourcePlugin) {
        Instant cachedAt = clock.instant();
        List<CitationEdge> resolved = new ArrayList<>();
        if (edges != null) {
            for (CitationEdge edge : edges) {
                resolved.add(edge.toBuilder()
                    .id(null)
                    .paperId(paperId)
                    .sourcePlugin(sourcePlugin)
                    .cachedAt(cachedAt)
                    .linkedPaperId(resolveLocalPaper(edge).map(Paper::getId).orElse(null))
                    .build());
            }
        }
        citationCacheRepository.replaceEdges(direction, paperId, resolved);
        log.debug("Cached {} {} edge(s) for paper {} from {}", resolved.size(), direction, paperId, sourcePlugin);
    }

    public CachedCitationGraph getCached(CitationDirection direction, Long paperId) {
        List<CitationEdge> edges = citationCacheRepository.findEdges(direction, paperId);
        if (edges.isEmpty()) {
            return CachedCitationGraph.empty();
        }
        CitationEdge first = edges.get(0);
        Instant cachedAt = first.getCachedAt();
        return new CachedCitationGraph(edges, first.getSourcePlugin(), cachedAt, isStale(cachedAt));
    }

    /**
     * A snapshot is stale once strictly more than the freshness window has elapsed
     */
    public boolean isStale(Instant cachedAt) {
        if (cachedAt == null) {
            return true;
        }
        Duration age = Duration.between(cachedAt, clock.instant());
        return age.compareTo(appProperties.getCache().getFreshness()) > 0;
    }

    /**
     * Points cached edges of other papers at a newly added paper when its identifiers match
     *
     * @param paperId the paper that just joined the library
     * @return number of edges linked
     */
    public int updateLibraryLinks(Long paperId) {
        Optional<Paper> found = paperRepository.findById(paperId);
        if (found.isEmpty()) {
            return 0;
        }
        Paper paper = found.get();
        int linked = 0;
        for (CitationDirection direction : CitationDirection.values()) {
            linked += citationCacheRepository.linkMatchingEdges(direction, paperId,
                paper.getDoi(), paper.getArxivId(), paper.getBibcode());
        }
        if (linked > 0) {
            log.info("Linked {} cached edge(s) to paper {}", linked, paperId);
        }
        return linked;
    }

    private Optional<Paper> resolveLocalPaper(CitationEdge edge) {
        Optional<Paper> linked = Optional.empty();
        if (edge.getDoi() != null && !edge.getDoi().isBlank()) {
            linked = paperRepository.findByDoi(edge.getDoi());
        }
        if (linked.isEmpty() && edge.getArxivId() != null && !edge.getArxivId().isBlank()) {
            linked = paperRepository.findByArxivId(edge.getArxivId());
        }
        if (linked.isEmpty() && edge.getBibcode() != null && !edge.getBibcode().isBlank()) {
            linked = paperRepository.findByBibcode(edge.getBibcode());
        }
        return linked;
    }
}
