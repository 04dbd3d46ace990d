/**
 * Client for TheGamesDB, the secondary media provider
 *
 * Features:
 * - Title search narrowed by platform id when the console is known
 * - Front box art as cover, screenshots resolved against the response's image base URL
 * - Overviews shaped into one or two readable paragraphs
 * - Guarded by the {@code theGamesDbProvider} circuit breaker
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
import java.util.Map;
import java.util.TreeMap;

@Service
public class TheGamesDbProviderClient implements GameMediaProvider {

    private static final Logger logger = LoggerFactory.getLogger(TheGamesDbProviderClient.class);
    private static final String API_NAME = ProviderId.THE_GAMES_DB.getDisplayName();
    static final String DEFAULT_IMAGE_BASE_URL = "https://cdn.thegamesdb.net/images/original/";

    private static final Map<String, String> PLATFORM_IDS = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        PLATFORM_IDS.put("NES", "7");
        PLATFORM_IDS.put("SNES", "6");
        PLATFORM_IDS.put("N64", "3");
        PLATFORM_IDS.put("Gamecube", "2");
        PLATFORM_IDS.put("Wii", "9");
        PLATFORM_IDS.put("Wii U", "38");
        PLATFORM_IDS.put("Switch", "4971");
        PLATFORM_IDS.put("Gameboy", "4");
        PLATFORM_IDS.put("GBA", "5");
        PLATFORM_IDS.put("DS", "8");
        PLATFORM_IDS.put("3DS", "4912");
        PLATFORM_IDS.put("PS1", "10");
        PLATFORM_IDS.put("PS2", "11");
        PLATFORM_IDS.put("PS3", "12");
        PLATFORM_IDS.put("PSP", "13");
        PLATFORM_IDS.put("PS Vita", "39");
        PLATFORM_IDS.put("XBOX", "14");
        PLATFORM_IDS.put("XBOX360", "15");
        PLATFORM_IDS.put("Megadrive", "18");
        PLATFORM_IDS.put("Dreamcast", "16");
        PLATFORM_IDS.put("Sega Master System", "35");
    }

    private final WebClient webClient;
    private final AppConfigurationProperties.Provider config;
    private final MediaCacheManager cacheManager;
    private final ImageDownloader imageDownloader;

    public TheGamesDbProviderClient(WebClient.Builder webClientBuilder,
                                    AppConfigurationProperties properties,
                                    MediaCacheManager cacheManager,
                                    ImageDownloader imageDownloader) {
        this.config = properties.getProviders().getThegamesdb();
        this.webClient = webClientBuilder.clone().baseUrl(config.getBaseUrl()).build();
        this.cacheManager = cacheManager;
        this.imageDownloader = imageDownloader;
    }

    @Override
    public ProviderId id() {
        return ProviderId.THE_GAMES_DB;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * TheGamesDB platform id for a catalog console name, or null when unknown
     */
    static String platformId(String platformHint) {
        return platformHint == null ? null : PLATFORM_IDS.get(platformHint.strip());
    }

    @Override
    @CircuitBreaker(name = "theGamesDbProvider", fallbackMethod = "searchDescriptionFallback")
    public Mono<String> searchDescription(String title, String platformHint) {
        if (!config.hasApiKey()) {
            ExternalApiLogger.logProviderDisabled(logger, API_NAME, title);
            return Mono.empty();
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "description", title);
        return searchGame(title, platformHint)
            .flatMap(game -> fetchOverview(game.path("id").asText()))
            .flatMap(overview -> Mono.justOrEmpty(DescriptionFormatter.paragraphs(overview)))
            .filter(description -> !description.isBlank())
            .doOnNext(description -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "description", title, 1))
            .onErrorMap(e -> ProviderErrors.translate(id(), "description lookup", e))
            .doOnError(e -> ExternalApiLogger.logApiCallFailure(logger, API_NAME, "description", title, e.getMessage()));
    }

    public Mono<String> searchDescriptionFallback(String title, String platformHint, Throwable t) {
        return Mono.error(fallbackError(title, "description lookup", t));
    }

    @Override
    @CircuitBreaker(name = "theGamesDbProvider", fallbackMethod = "fetchImagesFallback")
    public Mono<List<RawImage>> fetchImages(String title, String platformHint, ImageDeficit deficit) {
        if (deficit.isZero()) {
            return Mono.just(List.of());
        }
        if (!config.hasApiKey()) {
            ExternalApiLogger.logProviderDisabled(logger, API_NAME, title);
            return Mono.error(new ProviderUnavailableException(id(), "no API key configured"));
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "images", title);
        return searchGame(title, platformHint)
            .flatMap(game -> fetchImageListing(game.path("id").asText())
                .map(data -> imageCandidates(game.path("id").asText(), data, deficit)))
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
     * Candidates from an image listing: front box art first, then screenshots in listing order
     *
     * @param gameId game whose images are listed under {@code images.<gameId>}
     * @param data the {@code data} object of the images response
     */
    List<ImageCandidate> imageCandidates(String gameId, JsonNode data, ImageDeficit deficit) {
        String baseUrl = ProviderJson.text(data.path("base_url"), "original");
        if (baseUrl == null) {
            baseUrl = DEFAULT_IMAGE_BASE_URL;
        }
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }

        List<ImageCandidate> covers = new ArrayList<>();
        List<ImageCandidate> screenshots = new ArrayList<>();
        for (JsonNode image : data.path("images").path(gameId)) {
            String filename = ProviderJson.text(image, "filename");
            if (filename == null) {
                continue;
            }
            String url = filename.startsWith("http") ? filename : baseUrl + filename;
            String type = image.path("type").asText();
            if ("boxart".equals(type) && "front".equals(image.path("side").asText())) {
                covers.add(new ImageCandidate(url, FilenameUtils.providerFilename("boxart_front_", url), ImageCategory.COVER));
            } else if ("screenshot".equals(type)) {
                screenshots.add(new ImageCandidate(url, FilenameUtils.providerFilename("screenshot_", url), ImageCategory.SCREENSHOT));
            }
        }

        List<ImageCandidate> candidates = new ArrayList<>();
        if (deficit.needsCover()) {
            candidates.addAll(covers);
        }
        if (deficit.screenshotsNeeded() > 0) {
            candidates.addAll(screenshots);
        }
        return candidates;
    }

    private Mono<JsonNode> searchGame(String title, String platformHint) {
        String platformId = platformId(platformHint);
        String lookupKey = MediaCacheManager.lookupKey(API_NAME, title, platformId);
        return Mono.justOrEmpty(cacheManager.getSearchResult(lookupKey))
            .switchIfEmpty(Mono.defer(() -> {
                ExternalApiLogger.logHttpRequest(logger, "GET", "/Games/ByGameName?name=" + title);
                return webClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/Games/ByGameName")
                            .queryParam("apikey", "{apikey}")
                            .queryParam("name", "{name}");
                        if (platformId != null) {
                            uriBuilder.queryParam("platform", platformId);
                        }
                        return uriBuilder.build(config.getApiKey(), title);
                    })
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .flatMap(response -> Mono.justOrEmpty(bestMatch(response, title)))
                    .doOnNext(game -> cacheManager.putSearchResult(lookupKey, game));
            }));
    }

    private Mono<JsonNode> fetchImageListing(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            return Mono.empty();
        }
        ExternalApiLogger.logHttpRequest(logger, "GET", "/Games/Images?games_id=" + gameId);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/Games/Images")
                .queryParam("apikey", "{apikey}")
                .queryParam("games_id", "{id}")
                .build(config.getApiKey(), gameId))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .filter(TheGamesDbProviderClient::isOk)
            .map(response -> response.path("data"))
            .onErrorResume(ProviderErrors::isNotFound, e -> Mono.empty());
    }

    private Mono<String> fetchOverview(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            return Mono.empty();
        }
        ExternalApiLogger.logHttpRequest(logger, "GET", "/Games/ByGameID?id=" + gameId);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/Games/ByGameID")
                .queryParam("apikey", "{apikey}")
                .queryParam("id", "{id}")
                .queryParam("fields", "overview")
                .build(config.getApiKey(), gameId))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .filter(TheGamesDbProviderClient::isOk)
            .flatMap(response -> {
                JsonNode games = response.path("data").path("games");
                JsonNode game = games.isArray() && !games.isEmpty() ? games.get(0) : null;
                return Mono.justOrEmpty(ProviderJson.text(game, "overview"));
            })
            .onErrorResume(ProviderErrors::isNotFound, e -> Mono.empty());
    }

    static JsonNode bestMatch(JsonNode response, String title) {
        if (!isOk(response)) {
            return null;
        }
        JsonNode games = response.path("data").path("games");
        if (!games.isArray() || games.isEmpty()) {
            return null;
        }
        for (JsonNode game : games) {
            if (title.equalsIgnoreCase(game.path("game_title").asText())) {
                return game;
            }
        }
        return games.get(0);
    }

    private static boolean isOk(JsonNode response) {
        return response != null && response.path("code").asInt(200) == 200;
    }

    private Throwable fallbackError(String title, String operation, Throwable t) {
        if (t instanceof CallNotPermittedException) {
            ExternalApiLogger.logCircuitBreakerBlocked(logger, API_NAME, title);
        }
        return ProviderErrors.translate(id(), operation, t);
    }
}
