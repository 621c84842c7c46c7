/**
 * Service for raw HTTP access to the INSPIRE HEP literature API
 *
 * @author William Callahan
 *
 * Features:
 * - Literature search, single-record and BibTeX endpoints; no authentication
 * - Timeout and retry on transient server errors (500/502/503)
 * - Rate limited through the inspireApi Resilience4j limiter (15 requests per 5 seconds)
 * - A missing record completes empty; other failures surface as RemoteLookupException
 */
package com.williamcallahan.bibliography_engine.service.inspire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.williamcallahan.bibliography_engine.config.InspireConfigurationProperties;
import com.williamcallahan.bibliography_engine.monitoring.MetricsService;
import com.williamcallahan.bibliography_engine.service.lookup.RemoteLookupException;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.ExternalApiLogger;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

@Service
@Slf4j
public class InspireApiFetcher {

    static final String API_NAME = "INSPIRE";

    private static final MediaType BIBTEX = MediaType.parseMediaType("application/x-bibtex");

    private final WebClient webClient;
    private final InspireConfigurationProperties inspireProperties;
    private final MetricsService metricsService;

    public InspireApiFetcher(WebClient.Builder webClientBuilder,
                             InspireConfigurationProperties inspireProperties,
                             MetricsService metricsService) {
        this.webClient = webClientBuilder.clone()
            .baseUrl(inspireProperties.getApi().getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, inspireProperties.getApi().getUserAgent())
            .build();
        this.inspireProperties = inspireProperties;
        this.metricsService = metricsService;
    }

    public boolean isConfigured() {
        return inspireProperties.getApi().isEnabled() && ValidationUtils.hasText(inspireProperties.getApi().getBaseUrl());
    }

    /**
     * Runs a literature search
     *
     * @param query INSPIRE query string (e.g. {@code doi 10.1103/PhysRevLett.116.061102})
     * @param size maximum number of hits
     * @param sort {@code mostrecent}, {@code mostcited} or {@code bestmatch}
     * @return the {@code hits.hits} array (possibly empty)
     */
    @RateLimiter(name = "inspireApi")
    public Mono<JsonNode> search(String query, int size, String sort) {
        if (!isConfigured()) {
            return Mono.error(new RemoteLookupException(API_NAME, "INSPIRE source is disabled"));
        }
        ExternalApiLogger.logHttpRequest(log, "GET", "/literature?q=" + query);
        return webClient.get()
            .uri(builder -> builder.path("/literature")
                .queryParam("q", "{q}")
                .queryParam("size", size)
                .queryParam("sort", "{sort}")
                .build(Map.of("q", query, "sort", sort)))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .toEntity(JsonNode.class)
            .timeout(inspireProperties.getApi().getTimeout())
            .retryWhen(retry("INSPIRE search"))
            .doOnNext(entity -> recordResponse(entity, "/literature"))
            .map(entity -> hitsOf(entity.getBody()))
            .onErrorMap(e -> !(e instanceof RemoteLookupException), e -> toRemoteFailure("search", query, e));
    }

    /**
     * Fetches one literature record
     *
     * @param recid INSPIRE record id
     * @return the record body ({@code id}, {@code metadata}); empty when INSPIRE has no such record
     */
    @RateLimiter(name = "inspireApi")
    public Mono<JsonNode> record(String recid) {
        if (!isConfigured()) {
            return Mono.error(new RemoteLookupException(API_NAME, "INSPIRE source is disabled"));
        }
        String path = "/literature/" + recid;
        ExternalApiLogger.logHttpRequest(log, "GET", path);
        return webClient.get()
            .uri("/literature/{recid}", recid)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .toEntity(JsonNode.class)
            .timeout(inspireProperties.getApi().getTimeout())
            .retryWhen(retry("INSPIRE record"))
            .doOnNext(entity -> recordResponse(entity, path))
            .flatMap(entity -> Mono.justOrEmpty(entity.getBody()))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.info("INSPIRE has no record {}", recid);
                return Mono.empty();
            })
            .onErrorMap(e -> !(e instanceof RemoteLookupException), e -> toRemoteFailure("record", recid, e));
    }

    /**
     * BibTeX for every record matching the query, in one response
     *
     * @return the concatenated BibTeX text; empty when nothing matched
     */
    @RateLimiter(name = "inspireApi")
    public Mono<String> bibtex(String query, int size) {
        if (!isConfigured()) {
            return Mono.error(new RemoteLookupException(API_NAME, "INSPIRE source is disabled"));
        }
        ExternalApiLogger.logHttpRequest(log, "GET", "/literature?format=bibtex&q=" + query);
        return webClient.get()
            .uri(builder -> builder.path("/literature")
                .queryParam("q", "{q}")
                .queryParam("size", size)
                .queryParam("format", "bibtex")
                .build(Map.of("q", query)))
            .accept(BIBTEX, MediaType.TEXT_PLAIN)
            .retrieve()
            .toEntity(String.class)
            .timeout(inspireProperties.getApi().getTimeout())
            .retryWhen(retry("INSPIRE bibtex"))
            .doOnNext(entity -> {
                int length = entity.getBody() == null ? 0 : entity.getBody().length();
                ExternalApiLogger.logHttpResponse(log, entity.getStatusCode().value(), "/literature?format=bibtex", length);
                metricsService.recordRemoteResponse(length);
            })
            .flatMap(entity -> ValidationUtils.hasText(entity.getBody()) ? Mono.just(entity.getBody()) : Mono.<String>empty())
            .onErrorMap(e -> !(e instanceof RemoteLookupException), e -> toRemoteFailure("bibtex", query, e));
    }

    private reactor.util.retry.Retry retry(String operation) {
        return ErrorHandlingUtils.createWebClientRetry(log, operation,
            Math.max(0, inspireProperties.getApi().getMaxRetries() - 1), Duration.ofSeconds(2));
    }

    private void recordResponse(ResponseEntity<JsonNode> entity, String path) {
        JsonNode body = entity.getBody();
        int size = body == null ? 0 : body.toString().length();
        ExternalApiLogger.logHttpResponse(log, entity.getStatusCode().value(), path, size);
        metricsService.recordRemoteResponse(size);
    }

    private static JsonNode hitsOf(JsonNode body) {
        if (body == null) {
            return MissingNode.getInstance();
        }
        return body.path("hits").path("hits");
    }

    private RemoteLookupException toRemoteFailure(String operation, String query, Throwable e) {
        String message = "INSPIRE API error: " + ErrorHandlingUtils.describe(e);
        ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, query, message);
        metricsService.recordRemoteFailure(API_NAME, ErrorHandlingUtils.categorizeError(e));
        return new RemoteLookupException(API_NAME, message, e);
    }
}
