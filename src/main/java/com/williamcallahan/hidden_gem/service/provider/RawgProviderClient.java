/**
 * Client for the RAWG video game database, the primary media provider
 *
 * Features:
 * - Title search picking the exact (case-insensitive) name match, else the first hit
 * - Descriptions from game details, HTML stripped and cut to three sentences
 * - Cover from the game's background image, screenshots from the search hit's short screenshots
 * - Search hits cached so a description and an image lookup share one search call
 * - Guarded by the {@code rawgProvider} circuit breaker
 */
package com.williamcallahan.hidden_gem.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.hidden_gem.config.AppConfigurationProperties;
import com.williamcallahan.hidden_gem.exception.ProviderUnavailableException;
import com.williamcallahan.hidden_gem.service.image.ImageDownloader;
import com.williamcallahan.hidden_gem.service.image.MediaCacheManager;
import com.williamcallahan.hidden_gem.types.GameMediaProvider;
import com.williamcallahan.hidden_gem.types.ImageCandidate;
import com.williamcallahan.hidden_gem.types.ImageCategory;
import com.williamcallahan.hidden_gem.types.ImageDeficit;
import com.williamcallahan.hidden_gem.types.ProviderId;
import com.williamcallahan.hidden_gem.types.RawImage;
import com.williamcallahan.hidden_gem.util.DescriptionFormatter;
import com.williamcallahan.hidden_gem.util.ExternalApiLogger;
import com.williamcallahan.hidden_gem.util.FilenameUtils;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

@Service
public class RawgProviderClient implements GameMediaProvider {

    private static final Logger logger = LoggerFactory.getLogger(RawgProviderClient.class);
    private static final String API_NAME = ProviderId.RAWG.getDisplayName();
    private static final int SEARCH_PAGE_SIZE = 5;
    private static final int DESCRIPTION_SENTENCES = 3;

    private final WebClient webClient;
    private final AppConfigurationProperties.Provider config;
    private final MediaCacheManager cacheManager;
    private final ImageDownloader imageDownloader;

    public RawgProviderClient(WebClient.Builder webClientBuilder,
                              AppConfigurationProperties properties,
                              MediaCacheManager cacheManager,
                              ImageDownloader imageDownloader) {
        this.config = properties.getProviders().getRawg();
        this.webClient = webClientBuilder.clone().baseUrl(config.getBaseUrl()).build();
        this.cacheManager = cacheManager;
        this.imageDownloader = imageDownloader;
    }

    @Override
    public ProviderId id() {
        return ProviderId.RAWG;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    @CircuitBreaker(name = "rawgProvider", fallbackMethod = "searchDescriptionFallback")
    public Mono<String> searchDescription(String title, String platformHint) {
        if (!config.hasApiKey()) {
            ExternalApiLogger.logProviderDisabled(logger, API_NAME, title);
            return Mono.empty();
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "description", title);
        return searchGame(title)
            .flatMap(game -> fetchDetails(game.path("id").asText()))
            .flatMap(details -> {
                String raw = ProviderJson.text(details, "description_raw");
                if (raw == null) {
                    raw = ProviderJson.text(details, "description");
                }
                String description = DescriptionFormatter.firstSentences(raw, DESCRIPTION_SENTENCES);
                return description == null || description.isBlank() ? Mono.<String>empty() : Mono.just(description);
            })
            .doOnNext(description -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "description", title, 1))
            .onErrorMap(e -> ProviderErrors.translate(id(), "description lookup", e))
            .doOnError(e -> ExternalApiLogger.logApiCallFailure(logger, API_NAME, "description", title, e.getMessage()));
    }

    public Mono<String> searchDescriptionFallback(String title, String platformHint, Throwable t) {
        return Mono.error(fallbackError(title, "description lookup", t));
    }

    @Override
    @CircuitBreaker(name = "rawgProvider", fallbackMethod = "fetchImagesFallback")
    public Mono<List<RawImage>> fetchImages(String title, String platformHint, ImageDeficit deficit) {
        if (deficit.isZero()) {
            return Mono.just(List.of());
        }
        if (!config.hasApiKey()) {
            ExternalApiLogger.logProviderDisabled(logger, API_NAME, title);
            return Mono.error(new ProviderUnavailableException(id(), "no API key configured"));
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "images", title);
        return searchGame(title)
            .flatMap(game -> fetchDetails(game.path("id").asText())
                .map(details -> imageCandidates(game, details, deficit)))
            .flatMap(candidates -> imageDownloader.downloadAll(id(), candidates, deficit))
            .defaultIfEmpty(List.of())
            .doOnNext(images -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "images", title, images.size()))
            .onErrorMap(e -> ProviderErrors.translate(id(), "image lookup", e))
            .doOnError(e -> ExternalApiLogger.logApiCallFailure(logger, API_NAME, "images", title, e.getMessage()));
    }

    public Mono<List<RawImage>> fetchImagesFallback(String title, String platformHint, ImageDeficit deficit, Throwable t) {
        return Mono.error(fallbackError(title, "image lookup", t));
    }

    /**
     * Candidates in preference order: background image as cover, short screenshots, then the
     * additional background image as a screenshot
     */
    List<ImageCandidate> imageCandidates(JsonNode game, JsonNode details, ImageDeficit deficit) {
        List<ImageCandidate> candidates = new ArrayList<>();
        String coverUrl = ProviderJson.text(details, "background_image");
        if (coverUrl == null) {
            coverUrl = ProviderJson.text(game, "background_image");
        }
        if (deficit.needsCover() && coverUrl != null) {
            candidates.add(new ImageCandidate(coverUrl,
                FilenameUtils.providerFilename("background_", coverUrl), ImageCategory.COVER));
        }
        if (deficit.screenshotsNeeded() > 0) {
            for (JsonNode shot : game.path("short_screenshots")) {
                String url = ProviderJson.text(shot, "image");
                if (url == null || url.equals(coverUrl)) {
                    continue;
                }
                candidates.add(new ImageCandidate(url,
                    FilenameUtils.providerFilename("screenshot_", url), ImageCategory.SCREENSHOT));
            }
            String additional = ProviderJson.text(details, "background_image_additional");
            if (additional != null && !additional.equals(coverUrl)) {
                candidates.add(new ImageCandidate(additional,
                    FilenameUtils.providerFilename("screenshot_additional_", additional), ImageCategory.SCREENSHOT));
            }
        }
        return candidates;
    }

    private Mono<JsonNode> searchGame(String title) {
        String lookupKey = MediaCacheManager.lookupKey(API_NAME, title, null);
        return Mono.justOrEmpty(cacheManager.getSearchResult(lookupKey))
            .switchIfEmpty(Mono.defer(() -> {
                ExternalApiLogger.logHttpRequest(logger, "GET", "/games?search=" + title);
                return webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/games")
                        .queryParam("key", "{key}")
                        .queryParam("search", "{search}")
                        .queryParam("page_size", SEARCH_PAGE_SIZE)
                        .build(config.getApiKey(), title))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .flatMap(response -> Mono.justOrEmpty(bestMatch(response.path("results"), title)))
                    .doOnNext(game -> cacheManager.putSearchResult(lookupKey, game));
            }));
    }

    private Mono<JsonNode> fetchDetails(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            return Mono.empty();
        }
        ExternalApiLogger.logHttpRequest(logger, "GET", "/games/" + gameId);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/games/{id}")
                .queryParam("key", "{key}")
                .build(gameId, config.getApiKey()))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .onErrorResume(ProviderErrors::isNotFound, e -> Mono.empty());
    }

    static JsonNode bestMatch(JsonNode results, String title) {
        if (results == null || !results.isArray() || results.isEmpty()) {
            return null;
        }
        for (JsonNode result : results) {
            if (title.equalsIgnoreCase(result.path("name").asText())) {
                return result;
            }
        }
        return results.get(0);
    }

    private Throwable fallbackError(String title, String operation, Throwable t) {
        if (t instanceof CallNotPermittedException) {
            ExternalApiLogger.logCircuitBreakerBlocked(logger, API_NAME, title);
        }
        return ProviderErrors.translate(id(), operation, t);
    }
}
