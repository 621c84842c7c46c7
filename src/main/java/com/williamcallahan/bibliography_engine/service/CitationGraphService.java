/**
 * Serves reference and citation graphs from the cache, refreshing through the best linked source
 *
 * @author William Callahan
 *
 * Features:
 * - Fresh cache snapshots returned without remote calls
 * - Source chosen by capability, primary flag and priority
 * - Failed refreshes fall back to the stale snapshot
 */
package com.williamcallahan.bibliography_engine.service;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.mapper.CitationEdgeMapper;
import com.williamcallahan.bibliography_engine.model.PaperMetadata;
import com.williamcallahan.bibliography_engine.model.PaperSource;
import com.williamcallahan.bibliography_engine.repository.PaperRepository;
import com.williamcallahan.bibliography_engine.service.lookup.BibliographicLookupClient;
import com.williamcallahan.bibliography_engine.service.lookup.LookupClientRegistry;
import com.williamcallahan.bibliography_engine.types.CachedCitationGraph;
import com.williamcallahan.bibliography_engine.types.CitationDirection;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class CitationGraphService {

    private final PaperRepository paperRepository;
    private final PaperSourceService paperSourceService;
    private final CitationCacheService citationCacheService;
    private final LookupClientRegistry lookupClientRegistry;
    private final AppConfigurationProperties properties;

    public CitationGraphService(PaperRepository paperRepository,
                                PaperSourceService paperSourceService,
                                CitationCacheService citationCacheService,
                                LookupClientRegistry lookupClientRegistry,
                                AppConfigurationProperties properties) {
        this.paperRepository = paperRepository;
        this.paperSourceService = paperSourceService;
        this.citationCacheService = citationCacheService;
        this.lookupClientRegistry = lookupClientRegistry;
        this.properties = properties;
    }

    /**
     * Works cited by the paper
     *
     * @param paperId library paper id
     * @param forceRefresh fetch even when the cached snapshot is fresh
     * @return empty when the paper does not exist
     */
    public Optional<CachedCitationGraph> getReferences(Long paperId, boolean forceRefresh) {
        return getGraph(CitationDirection.REFERENCES, paperId, forceRefresh);
    }

    /**
     * Works citing the paper
     */
    public Optional<CachedCitationGraph> getCitations(Long paperId, boolean forceRefresh) {
        return getGraph(CitationDirection.CITATIONS, paperId, forceRefresh);
    }

    public Optional<CachedCitationGraph> getGraph(CitationDirection direction, Long paperId, boolean forceRefresh) {
        if (paperId == null || paperRepository.findById(paperId).isEmpty()) {
            return Optional.empty();
        }
        CachedCitationGraph cached = citationCacheService.getCached(direction, paperId);
        if (!forceRefresh && !cached.isEmpty() && !cached.isStale()) {
            return Optional.of(cached);
        }
        return Optional.of(refresh(direction, paperId).orElse(cached));
    }

    /**
     * Re-fetches one direction from the best qualifying source and replaces the cached snapshot
     *
     * @return the new snapshot, or empty when no source qualifies or the fetch failed
     */
    public Optional<CachedCitationGraph> refresh(CitationDirection direction, Long paperId) {
        List<PaperSource> sources = paperSourceService.getPaperSources(paperId);
        Optional<PaperSource> best = direction == CitationDirection.REFERENCES
            ? paperSourceService.findBestSourceForRefs(sources)
            : paperSourceService.findBestSourceForCites(sources);
        if (best.isEmpty()) {
            log.debug("No source offers {} for paper {}", direction, paperId);
            return Optional.empty();
        }
        PaperSource source = best.get();
        Optional<BibliographicLookupClient> client = lookupClientRegistry.find(source.getSource());
        if (client.isEmpty() || !client.get().isConfigured()) {
            log.debug("Source {} for paper {} has no configured client", source.getSource(), paperId);
            return Optional.empty();
        }
        try {
            List<PaperMetadata> records = (direction == CitationDirection.REFERENCES
                    ? client.get().getReferences(source.getSourceId())
                    : client.get().getCitations(source.getSourceId()))
                .blockOptional(properties.getSync().getLookupTimeout())
                .orElse(List.of());
            citationCacheService.cacheEdges(direction, paperId, CitationEdgeMapper.fromMetadata(records), source.getSource());
            return Optional.of(citationCacheService.getCached(direction, paperId));
        } catch (RuntimeException e) {
            log.warn("Refreshing {} for paper {} from {} failed: {}", direction, paperId, source.getSource(),
                ErrorHandlingUtils.describe(e));
            return Optional.empty();
        }
    }
}
