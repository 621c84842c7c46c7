package com.williamcallahan.bibliography_engine.controller;

import com.williamcallahan.bibliography_engine.model.CitationEdge;
import com.williamcallahan.bibliography_engine.service.CitationGraphService;
import com.williamcallahan.bibliography_engine.service.PaperImportService;
import com.williamcallahan.bibliography_engine.types.CachedCitationGraph;
import com.williamcallahan.bibliography_engine.types.PaperImportResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Citation graph access and single-record import for library papers.
 */
@RestController
@RequestMapping("/api/papers")
public class PaperCitationController {

    private final CitationGraphService citationGraphService;
    private final PaperImportService paperImportService;

    public PaperCitationController(CitationGraphService citationGraphService, PaperImportService paperImportService) {
        this.citationGraphService = citationGraphService;
        this.paperImportService = paperImportService;
    }

    @GetMapping("/{id}/references")
    public ResponseEntity<Map<String, Object>> references(@PathVariable("id") Long id,
                                                          @RequestParam(name = "refresh", defaultValue = "false") boolean refresh) {
        return toResponse(citationGraphService.getReferences(id, refresh));
    }

    @GetMapping("/{id}/citations")
    public ResponseEntity<Map<String, Object>> citations(@PathVariable("id") Long id,
                                                         @RequestParam(name = "refresh", defaultValue = "false") boolean refresh) {
        return toResponse(citationGraphService.getCitations(id, refresh));
    }

    /**
     * Imports one record from a named source, reusing the existing paper when the work is already in the library
     *
     * @return 201 when a paper was created, 200 when matched, 404 when the source has no such record
     */
    @PostMapping("/import")
    public ResponseEntity<Map<String, Object>> importPaper(@RequestParam("source") String source,
                                                           @RequestParam("identifier") String identifier) {
        Optional<PaperImportResult> imported = paperImportService.importFromSource(source, identifier);
        if (imported.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        PaperImportResult result = imported.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("paperId", result.paper().getId());
        body.put("created", result.created());
        body.put("linkedEdges", result.linkedEdges());
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    private static ResponseEntity<Map<String, Object>> toResponse(Optional<CachedCitationGraph> graph) {
        if (graph.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        CachedCitationGraph snapshot = graph.get();
        List<Map<String, Object>> edges = snapshot.getEdges().stream().map(PaperCitationController::toView).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("edges", edges);
        body.put("sourcePlugin", snapshot.getSourcePlugin());
        body.put("cachedAt", snapshot.getCachedAt());
        body.put("isStale", snapshot.isStale());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> toView(CitationEdge edge) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("bibcode", edge.getBibcode());
        view.put("doi", edge.getDoi());
        view.put("arxivId", edge.getArxivId());
        view.put("title", edge.getTitle());
        view.put("authors", edge.getAuthors());
        view.put("year", edge.getYear());
        view.put("journal", edge.getJournal());
        view.put("citationCount", edge.getCitationCount());
        view.put("inLibrary", edge.isInLibrary());
        view.put("linkedPaperId", edge.getLinkedPaperId());
        return view;
    }
}
