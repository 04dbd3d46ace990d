/**
 * Prefetches media for the whole catalog
 *
 * Features:
 * - Inspects every catalog game against a policy that also requires a description
 * - Resolves incomplete games one by one, bounded per run, so provider quotas are shared fairly
 * - Respects the resolve cooldown, so games the providers cannot complete are not retried every run
 * - A store failure for one game is counted and the run continues with the next game
 */
package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.catalog.CatalogGame;
import com.williamcallahan.hidden_gem.catalog.GameCatalog;
import com.williamcallahan.hidden_gem.config.AppConfigurationProperties;
import com.williamcallahan.hidden_gem.exception.MediaStoreException;
import com.williamcallahan.hidden_gem.types.CacheStatus;
import com.williamcallahan.hidden_gem.types.CompletenessPolicy;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.MediaRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
public class MediaPrefetchService {

    private final GameCatalog gameCatalog;
    private final MediaResolutionOrchestrator orchestrator;
    private final int defaultMaxGames;
    private final int maxImages;

    public MediaPrefetchService(GameCatalog gameCatalog,
                                MediaResolutionOrchestrator orchestrator,
                                AppConfigurationProperties properties) {
        this.gameCatalog = gameCatalog;
        this.orchestrator = orchestrator;
        this.defaultMaxGames = properties.getPrefetch().getMaxGamesPerRun();
        this.maxImages = properties.getMedia().getDefaultMaxImages();
    }

    public PrefetchSummary prefetch() {
        return prefetch(defaultMaxGames);
    }

    /**
     * Resolves up to {@code maxGames} incomplete catalog games
     *
     * @param maxGames resolution budget of this run; 0 or less means no limit
     */
    public PrefetchSummary prefetch(int maxGames) {
        CompletenessPolicy policy = CompletenessPolicy.forMaxImages(maxImages, true);
        List<CatalogGame> games = gameCatalog.listGames();
        log.info("Starting media prefetch for {} catalog games (budget {})", games.size(), maxGames > 0 ? maxGames : "unlimited");

        int inspected = 0;
        int resolved = 0;
        int complete = 0;
        int failed = 0;
        for (CatalogGame game : games) {
            if (maxGames > 0 && resolved >= maxGames) {
                log.info("Prefetch budget of {} resolutions used, stopping", maxGames);
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.info("Prefetch interrupted, stopping");
                break;
            }
            GameKey key = game.toKey();
            CacheStatus status;
            try {
                status = orchestrator.inspect(key, policy);
            } catch (MediaStoreException e) {
                log.error("Could not inspect {}: {}", key, e.getMessage());
                inspected++;
                failed++;
                continue;
            }
            inspected++;
            if (status.satisfiesPolicy()) {
                complete++;
                continue;
            }

            resolved++;
            try {
                MediaRecord record = orchestrator.resolve(key, policy, false);
                log.info("[{}] {}: {} image(s), description {}", resolved, key, record.imageCount(),
                    record.hasDescription() ? "present" : "missing");
            } catch (MediaStoreException e) {
                failed++;
                log.error("Prefetch of {} failed: {}", key, e.getMessage());
            }
        }

        PrefetchSummary summary = new PrefetchSummary(inspected, resolved, complete, failed);
        log.info("Media prefetch finished: {}", summary);
        return summary;
    }

    /**
     * Runs a prefetch on the async task executor
     */
    @Async
    public CompletableFuture<PrefetchSummary> prefetchAsync() {
        return CompletableFuture.completedFuture(prefetch());
    }
}
