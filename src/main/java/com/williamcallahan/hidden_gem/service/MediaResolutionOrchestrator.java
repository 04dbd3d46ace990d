/**
 * Orchestrates media resolution for games: cache inspection, provider walk and persistence
 *
 * Features:
 * - Satisfied caches short-circuit without any network call
 * - Recently resolved but incomplete games are returned as-is until the cooldown expires,
 *   unless the last provider walk asked for less than the current caller wants
 * - Providers are walked in priority order, each call gated by the shared rate limiter
 * - Only the missing covers and screenshots are requested, and each batch is persisted immediately
 * - Provider failures and timeouts advance the walk; only store failures fail a resolution
 * - Concurrent resolutions of the same game share one provider walk and its result; a caller
 *   wanting more than the running walk asks for waits for it and then walks on its own
 * - Admin-authored descriptions are never replaced by provider text
 */
package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.config.AppConfigurationProperties;
import com.williamcallahan.hidden_gem.exception.MediaStoreException;
import com.williamcallahan.hidden_gem.exception.ProviderUnavailableException;
import com.williamcallahan.hidden_gem.monitoring.MetricsService;
import com.williamcallahan.hidden_gem.repository.MediaStore;
import com.williamcallahan.hidden_gem.service.image.CacheInspector;
import com.williamcallahan.hidden_gem.service.image.ImageCategorizer;
import com.williamcallahan.hidden_gem.service.image.MediaRecordAssembler;
import com.williamcallahan.hidden_gem.types.CacheStatus;
import com.williamcallahan.hidden_gem.types.CompletenessPolicy;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.GameMediaProvider;
import com.williamcallahan.hidden_gem.types.ImageAsset;
import com.williamcallahan.hidden_gem.types.ImageCategory;
import com.williamcallahan.hidden_gem.types.ImageDeficit;
import com.williamcallahan.hidden_gem.types.MediaMetadata;
import com.williamcallahan.hidden_gem.types.MediaRecord;
import com.williamcallahan.hidden_gem.types.RateLimitDecision;
import com.williamcallahan.hidden_gem.types.RawImage;
import com.williamcallahan.hidden_gem.types.ResolutionState;
import com.williamcallahan.hidden_gem.util.ExternalApiLogger;
import com.williamcallahan.hidden_gem.util.FilenameUtils;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

@Service
public class MediaResolutionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(MediaResolutionOrchestrator.class);

    private final MediaStore mediaStore;
    private final CacheInspector cacheInspector;
    private final ImageCategorizer categorizer;
    private final MediaRecordAssembler assembler;
    private final ProviderRateLimiter rateLimiter;
    private final List<GameMediaProvider> providers;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Executor resolutionExecutor;

    private final int defaultMaxImages;
    private final boolean requireDescription;
    private final Duration resolveCooldown;
    private final Duration providerTimeout;

    // Keyed by directory name so every spelling of the same title shares one resolution
    private final ConcurrentHashMap<String, InFlightResolution> inFlight = new ConcurrentHashMap<>();

    private static final class InFlightResolution {
        private final CompletableFuture<MediaRecord> result = new CompletableFuture<>();
        private final CompletenessPolicy policy;
        private volatile ResolutionState state = ResolutionState.IDLE;

        private InFlightResolution(CompletenessPolicy policy) {
            this.policy = policy;
        }
    }

    public MediaResolutionOrchestrator(MediaStore mediaStore,
                                       CacheInspector cacheInspector,
                                       ImageCategorizer categorizer,
                                       MediaRecordAssembler assembler,
                                       ProviderRateLimiter rateLimiter,
                                       List<GameMediaProvider> providers,
                                       MetricsService metricsService,
                                       AppConfigurationProperties properties,
                                       Clock clock,
                                       @Qualifier("mediaResolutionExecutor") Executor resolutionExecutor) {
        this.mediaStore = mediaStore;
        this.cacheInspector = cacheInspector;
        this.categorizer = categorizer;
        this.assembler = assembler;
        this.rateLimiter = rateLimiter;
        this.providers = providers.stream()
            .sorted(Comparator.comparingInt(p -> p.id().getPriority()))
            .toList();
        this.metricsService = metricsService;
        this.clock = clock;
        this.resolutionExecutor = resolutionExecutor;
        this.defaultMaxImages = properties.getMedia().getDefaultMaxImages();
        this.requireDescription = properties.getMedia().isRequireDescription();
        this.resolveCooldown = properties.getMedia().getResolveCooldown();
        this.providerTimeout = properties.getMedia().getProviderTimeout();
    }

    public MediaRecord resolve(GameKey key) {
        return resolve(key, defaultMaxImages, false);
    }

    /**
     * Resolves the media of a game, fetching from providers only what the cache is missing
     *
     * @param key game to resolve
     * @param maxImages images wanted in total: one cover plus {@code maxImages - 1} screenshots
     * @param forceRefresh skip the cache short-circuit and the cooldown
     * @return the stored media with the cover first, limited to {@code maxImages} images; may be partial
     * @throws IllegalArgumentException if {@code maxImages < 1}
     * @throws MediaStoreException if the store cannot be read or written
     */
    public MediaRecord resolve(GameKey key, int maxImages, boolean forceRefresh) {
        return resolve(key, CompletenessPolicy.forMaxImages(maxImages, requireDescription), forceRefresh);
    }

    /**
     * Resolves against an explicit policy, used by maintenance runs that also want descriptions
     *
     * @return the stored media limited to {@code policy.totalImages()} images
     */
    public MediaRecord resolve(GameKey key, CompletenessPolicy policy, boolean forceRefresh) {
        int maxImages = policy.totalImages();
        String lockKey = key.directoryName();

        InFlightResolution mine = new InFlightResolution(policy);
        InFlightResolution running;
        while ((running = inFlight.putIfAbsent(lockKey, mine)) != null) {
            if (running.policy.covers(policy)) {
                metricsService.incrementDeduplicated();
                logger.debug("Joining in-flight resolution of {} (state {})", key, running.state);
                return awaitResult(running).limitImages(maxImages);
            }
            logger.debug("Waiting for the smaller in-flight resolution of {} before resolving {} image(s)", key, maxImages);
            running.result.handle((done, error) -> null).join();
            inFlight.remove(lockKey, running);
        }

        try {
            MediaRecord record = runResolution(key, policy, forceRefresh, mine);
            mine.result.complete(record);
            return record.limitImages(maxImages);
        } catch (RuntimeException | Error e) {
            mine.state = ResolutionState.FAILED;
            mine.result.completeExceptionally(e);
            metricsService.recordResolution(ResolutionState.FAILED, false);
            logger.error("Resolution of {} failed: {}", key, e.getMessage(), e);
            throw e;
        } finally {
            inFlight.remove(lockKey, mine);
        }
    }

    /**
     * Runs {@link #resolve(GameKey, int, boolean)} on the media resolution executor
     */
    public CompletableFuture<MediaRecord> resolveAsync(GameKey key, int maxImages, boolean forceRefresh) {
        return CompletableFuture.supplyAsync(() -> resolve(key, maxImages, forceRefresh), resolutionExecutor);
    }

    /**
     * Reports what is stored for a game without touching any provider
     */
    public CacheStatus inspect(GameKey key, CompletenessPolicy policy) {
        return cacheInspector.inspect(key, policy);
    }

    public CacheStatus inspect(GameKey key) {
        return inspect(key, defaultPolicy());
    }

    public CompletenessPolicy defaultPolicy() {
        return CompletenessPolicy.forMaxImages(defaultMaxImages, requireDescription);
    }

    /**
     * State of the resolution currently running for a game, empty when none is
     */
    public Optional<ResolutionState> inFlightState(GameKey key) {
        InFlightResolution running = inFlight.get(key.directoryName());
        return running == null ? Optional.empty() : Optional.of(running.state);
    }

    private MediaRecord awaitResult(InFlightResolution running) {
        try {
            return running.result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private MediaRecord runResolution(GameKey key, CompletenessPolicy policy, boolean forceRefresh,
                                      InFlightResolution resolution) {
        transition(key, resolution, ResolutionState.INSPECTING);
        List<ImageAsset> assets = mediaStore.listAssets(key);
        MediaMetadata metadata = mediaStore.readMetadata(key);
        CacheStatus status = cacheInspector.inspect(key, assets, metadata, policy);

        if (!forceRefresh) {
            if (status.satisfiesPolicy()) {
                transition(key, resolution, ResolutionState.SATISFIED);
                metricsService.incrementCacheHit();
                return finish(key, resolution, assembler.assemble(key, assets, metadata), true);
            }
            if (withinCooldown(metadata, policy)) {
                logger.debug("{} is incomplete but was resolved at {}, skipping providers", key, metadata.lastResolvedAt());
                metricsService.incrementCooldownHit();
                return finish(key, resolution, assembler.assemble(key, assets, metadata), false);
            }
        }

        transition(key, resolution, ResolutionState.NEEDS_FETCH);
        metricsService.incrementActiveResolutions();
        Timer.Sample sample = metricsService.startResolutionTimer();
        try {
            FetchOutcome outcome = walkProviders(key, policy, status, metadata, resolution);
            if (outcome.cancelled()) {
                logger.info("Resolution of {} cancelled, keeping {} image(s) persisted so far", key, outcome.added());
            }
            mediaStore.markResolved(key, clock.instant(), policy);
            if (outcome.cancelled()) {
                Thread.currentThread().interrupt();
            }
        } finally {
            metricsService.decrementActiveResolutions();
            metricsService.stopResolutionTimer(sample);
        }

        List<ImageAsset> finalAssets = mediaStore.listAssets(key);
        MediaMetadata finalMetadata = mediaStore.readMetadata(key);
        boolean complete = cacheInspector.inspect(key, finalAssets, finalMetadata, policy).satisfiesPolicy();
        return finish(key, resolution, assembler.assemble(key, finalAssets, finalMetadata), complete);
    }

    private record FetchOutcome(int added, boolean cancelled) { }

    private FetchOutcome walkProviders(GameKey key, CompletenessPolicy policy, CacheStatus status,
                                       MediaMetadata metadata, InFlightResolution resolution) {
        ImageDeficit deficit = status.deficit(policy);
        boolean hasDescription = metadata.hasDescription();
        int added = 0;
        ExternalApiLogger.logResolutionStart(logger, key.toString(), deficit.coversNeeded(), deficit.screenshotsNeeded());

        for (GameMediaProvider provider : providers) {
            if (Thread.interrupted()) {
                return new FetchOutcome(added, true);
            }
            boolean wantsDescription = !hasDescription && provider.supportsDescriptions();
            if (deficit.isZero() && !(wantsDescription && policy.requireDescription())) {
                break;
            }
            if (!provider.isEnabled()) {
                continue;
            }

            if (wantsDescription) {
                if (!acquire(provider, key)) {
                    if (Thread.interrupted()) {
                        return new FetchOutcome(added, true);
                    }
                    continue;
                }
                hasDescription = fetchDescription(key, provider);
                if (Thread.interrupted()) {
                    return new FetchOutcome(added, true);
                }
            }

            if (deficit.isZero()) {
                continue;
            }
            if (!acquire(provider, key)) {
                if (Thread.interrupted()) {
                    return new FetchOutcome(added, true);
                }
                continue;
            }

            transition(key, resolution, ResolutionState.FETCHING);
            List<RawImage> fetched = fetchImages(key, provider, deficit);
            if (Thread.interrupted()) {
                return new FetchOutcome(added, true);
            }

            transition(key, resolution, ResolutionState.CATEGORIZING);
            List<RawImage> accepted = selectImages(key, fetched, deficit);

            transition(key, resolution, ResolutionState.PERSISTING);
            for (RawImage image : accepted) {
                mediaStore.saveAsset(key, image.filename(), image.bytes(), provider.id().getDisplayName());
                added++;
            }
            if (!accepted.isEmpty()) {
                metricsService.incrementPersistedImages(accepted.size());
                logger.info("Persisted {} image(s) for {} from {}", accepted.size(), key, provider.id().getDisplayName());
            }
            deficit = cacheInspector.inspect(key, policy).deficit(policy);
        }

        ExternalApiLogger.logResolutionComplete(logger, key.toString(), added, deficit.total());
        return new FetchOutcome(added, false);
    }

    private boolean acquire(GameMediaProvider provider, GameKey key) {
        RateLimitDecision decision = rateLimiter.acquire(provider.id());
        if (!decision.proceed()) {
            metricsService.incrementQuotaSkip(provider.id());
            logger.info("Skipping {} for {}: no request budget left", provider.id().getDisplayName(), key);
            return false;
        }
        return true;
    }

    /**
     * Looks up a description and stores it unless one exists by now
     *
     * @return whether the game has a description afterwards
     */
    private boolean fetchDescription(GameKey key, GameMediaProvider provider) {
        metricsService.incrementProviderCall(provider.id(), "description");
        String description;
        try {
            description = provider.searchDescription(key.title(), key.platform())
                .timeout(providerTimeout)
                .block();
        } catch (RuntimeException e) {
            handleProviderFailure(key, provider, "description lookup", e);
            return mediaStore.readMetadata(key).hasDescription();
        }
        if (description == null || description.isBlank()) {
            logger.debug("{} has no description for {}", provider.id().getDisplayName(), key);
            return mediaStore.readMetadata(key).hasDescription();
        }
        if (mediaStore.setProviderDescriptionIfAbsent(key, description)) {
            logger.info("Stored {} description for {}", provider.id().getDisplayName(), key);
        }
        return true;
    }

    private List<RawImage> fetchImages(GameKey key, GameMediaProvider provider, ImageDeficit deficit) {
        metricsService.incrementProviderCall(provider.id(), "images");
        try {
            List<RawImage> images = provider.fetchImages(key.title(), key.platform(), deficit)
                .timeout(providerTimeout)
                .block();
            return images == null ? List.of() : images;
        } catch (RuntimeException e) {
            handleProviderFailure(key, provider, "image fetch", e);
            return List.of();
        }
    }

    private void handleProviderFailure(GameKey key, GameMediaProvider provider, String operation, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            logger.debug("{} {} for {} interrupted", provider.id().getDisplayName(), operation, key);
            return;
        }
        boolean rateLimited = cause instanceof ProviderUnavailableException unavailable && unavailable.isRateLimited();
        if (rateLimited) {
            rateLimiter.recordRateLimited(provider.id());
        }
        metricsService.incrementProviderFailure(provider.id(), rateLimited);
        logger.warn("{} {} failed for {}, moving on: {}", provider.id().getDisplayName(), operation, key, cause.toString());
    }

    /**
     * Picks the images that fill the deficit, in provider order
     * - Filenames already stored are skipped, existing files are never overwritten
     * - When a cover is missing and the provider returned none, its first screenshot is renamed to a cover
     */
    private List<RawImage> selectImages(GameKey key, List<RawImage> fetched, ImageDeficit deficit) {
        int coversLeft = deficit.coversNeeded();
        int screenshotsLeft = deficit.screenshotsNeeded();
        boolean providerHasCover = fetched.stream().anyMatch(image -> isUsable(image) && categorizer.isCover(image.filename()));

        List<RawImage> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RawImage image : fetched) {
            if (!isUsable(image)) {
                logger.warn("Ignoring unusable image '{}' from {}", image.filename(), image.sourceProvider());
                continue;
            }
            RawImage candidate = image;
            ImageCategory category = categorizer.categorize(candidate.filename());
            if (category == ImageCategory.SCREENSHOT && coversLeft > 0 && !providerHasCover) {
                candidate = candidate.withFilename(categorizer.promotedCoverFilename(candidate.filename()));
                category = ImageCategory.COVER;
            }
            if (!seen.add(candidate.filename()) || mediaStore.hasAsset(key, candidate.filename())) {
                logger.debug("{} already stored for {}, skipping", candidate.filename(), key);
                continue;
            }
            if (category == ImageCategory.COVER) {
                if (coversLeft == 0) {
                    continue;
                }
                coversLeft--;
            } else {
                if (screenshotsLeft == 0) {
                    continue;
                }
                screenshotsLeft--;
            }
            accepted.add(candidate);
            if (coversLeft == 0 && screenshotsLeft == 0) {
                break;
            }
        }
        return accepted;
    }

    private static boolean isUsable(RawImage image) {
        if (image == null || image.bytes() == null || image.bytes().length == 0) {
            return false;
        }
        try {
            FilenameUtils.requireSafeFilename(image.filename());
        } catch (IllegalArgumentException e) {
            return false;
        }
        return FilenameUtils.isImageFile(image.filename());
    }

    /**
     * Whether a recent provider walk already tried to satisfy {@code policy}; a walk for a smaller
     * policy never requested the images this caller is missing
     */
    private boolean withinCooldown(MediaMetadata metadata, CompletenessPolicy policy) {
        Instant last = metadata.lastResolvedAt();
        return metadata.wasResolvedFor(policy) && last.plus(resolveCooldown).isAfter(clock.instant());
    }

    private MediaRecord finish(GameKey key, InFlightResolution resolution, MediaRecord record, boolean complete) {
        transition(key, resolution, ResolutionState.DONE);
        metricsService.recordResolution(ResolutionState.DONE, complete);
        logger.debug("Resolved {}: {} image(s), complete={}", key, record.imageCount(), complete);
        return record;
    }

    private void transition(GameKey key, InFlightResolution resolution, ResolutionState next) {
        logger.debug("{}: {} -> {}", key, resolution.state, next);
        resolution.state = next;
    }
}
