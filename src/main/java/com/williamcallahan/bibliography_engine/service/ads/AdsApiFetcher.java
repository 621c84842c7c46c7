/**
 * Service for raw HTTP access to the NASA ADS API
 *
 * @author William Callahan
 *
 * Features:
 * - Search and BibTeX export endpoints with bearer-token auth
 * - Timeout and retry on transient server errors (500/502/503)
 * - Rate limited through the adsApi Resilience4j limiter
 * - Failures surface as RemoteLookupException carrying the underlying message
 */
package com.williamcallahan.bibliography_engine.service.ads;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.williamcallahan.bibliography_engine.config.AdsConfigurationProperties;
import com.williamcallahan.bibliography_engine.monitoring.MetricsService;
import com.williamcallahan.bibliography_engine.service.lookup.RemoteLookupException;
import com.williamcallahan.bibliography_engine.util.ErrorHandlingUtils;
import com.williamcallahan.bibliography_engine.util.ExternalApiLogger;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class AdsApiFetcher {

    static final String API_NAME = "ADS";

    public static final String DEFAULT_FIELDS =
        "bibcode,title,author,year,doi,abstract,keyword,pub,identifier,arxiv_class,citation_count";

    private final WebClient webClient;
    private final AdsConfigurationProperties adsProperties;
    private final MetricsService metricsService;

    public AdsApiFetcher(WebClient.Builder webClientBuilder,
                         AdsConfigurationProperties adsProperties,
                         MetricsService metricsService) {
        this.webClient = webClientBuilder.clone()
            .baseUrl(adsProperties.getApi().getBaseUrl())
            .build();
        this.adsProperties = adsProperties;
        this.metricsService = metricsService;
    }

    public boolean isConfigured() {
        return ValidationUtils.hasText(adsProperties.getApi().getToken());
    }

    /**
     * Runs an ADS search query
     *
     * @param query ADS query string (e.g. {@code bibcode:"2023ApJ...1A"})
     * @param fields comma-separated field list
     * @param rows maximum number of documents
     * @param sort ADS sort expression
     * @return the {@code response.docs} array (possibly empty)
     */
    @RateLimiter(name = "adsApi")
    public Mono<JsonNode> search(String query, String fields, int rows, String sort) {
        if (!isConfigured()) {
            return Mono.error(new RemoteLookupException(API_NAME, "No ADS API token configured"));
        }
        ExternalApiLogger.logHttpRequest(log, "GET", "/search/query?q=" + query);
        return webClient.get()
            .uri(builder -> builder.path("/search/query")
                .queryParam("q", "{q}")
                .queryParam("fl", "{fl}")
                .queryParam("rows", rows)
                .queryParam("sort", "{sort}")
                .build(Map.of("q", query, "fl", fields, "sort", sort)))
            .headers(headers -> headers.setBearerAuth(adsProperties.getApi().getToken()))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .toEntity(JsonNode.class)
            .timeout(adsProperties.getApi().getTimeout())
            .retryWhen(ErrorHandlingUtils.createWebClientRetry(log, "ADS search",
                Math.max(0, adsProperties.getApi().getMaxRetries() - 1), Duration.ofSeconds(2)))
            .doOnNext(entity -> recordResponse(entity, "/search/query"))
            .map(entity -> docsOf(entity.getBody()))
            .onErrorMap(e -> !(e instanceof RemoteLookupException), e -> toRemoteFailure("search", query, e));
    }

    /**
     * Exports BibTeX for the given bibcodes in one request
     *
     * @return the concatenated BibTeX text; empty when ADS returned nothing
     */
    @RateLimiter(name = "adsApi")
    public Mono<String> exportBibtex(List<String> bibcodes) {
        if (!isConfigured()) {
            return Mono.error(new RemoteLookupException(API_NAME, "No ADS API token configured"));
        }
        if (bibcodes == null || bibcodes.isEmpty()) {
            return Mono.empty();
        }
        ExternalApiLogger.logHttpRequest(log, "POST", "/export/bibtex (" + bibcodes.size() + " bibcodes)");
        return webClient.post()
            .uri("/export/bibtex")
            .headers(headers -> headers.setBearerAuth(adsProperties.getApi().getToken()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("bibcode", bibcodes))
            .retrieve()
            .toEntity(JsonNode.class)
            .timeout(adsProperties.getApi().getTimeout())
            .retryWhen(ErrorHandlingUtils.createWebClientRetry(log, "ADS export",
                Math.max(0, adsProperties.getApi().getMaxRetries() - 1), Duration.ofSeconds(2)))
            .doOnNext(entity -> recordResponse(entity, "/export/bibtex"))
            .flatMap(entity -> {
                JsonNode body = entity.getBody();
                String export = body == null ? null : body.path("export").asText(null);
                return ValidationUtils.hasText(export) ? Mono.just(export) : Mono.<String>empty();
            })
            .onErrorMap(e -> !(e instanceof RemoteLookupException),
                e -> toRemoteFailure("export", bibcodes.size() + " bibcodes", e));
    }

    private void recordResponse(ResponseEntity<JsonNode> entity, String path) {
        JsonNode body = entity.getBody();
        int size = body == null ? 0 : body.toString().length();
        ExternalApiLogger.logHttpResponse(log, entity.getStatusCode().value(), path, size);
        metricsService.recordRemoteResponse(size);
    }

    private static JsonNode docsOf(JsonNode body) {
        if (body == null) {
            return MissingNode.getInstance();
        }
        return body.path("response").path("docs");
    }

    private RemoteLookupException toRemoteFailure(String operation, String query, Throwable e) {
        String message = "ADS API error: " + ErrorHandlingUtils.describe(e);
        ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, query, message);
        metricsService.recordRemoteFailure(API_NAME, ErrorHandlingUtils.categorizeError(e));
        return new RemoteLookupException(API_NAME, message, e);
    }
}
