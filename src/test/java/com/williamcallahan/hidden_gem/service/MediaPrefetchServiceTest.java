package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.catalog.CatalogGame;
import com.williamcallahan.hidden_gem.catalog.GameCatalog;
import com.williamcallahan.hidden_gem.config.AppConfigurationProperties;
import com.williamcallahan.hidden_gem.exception.MediaStoreException;
import com.williamcallahan.hidden_gem.types.CacheStatus;
import com.williamcallahan.hidden_gem.types.CompletenessPolicy;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.MediaRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MediaPrefetchServiceTest {

    private static final CompletenessPolicy POLICY = CompletenessPolicy.forMaxImages(5, true);

    private static final CatalogGame METROID = new CatalogGame("Super Metroid", "Nintendo", "SNES");
    private static final CatalogGame ZELDA = new CatalogGame("The Legend of Zelda", "Nintendo", "NES");
    private static final CatalogGame SONIC = new CatalogGame("Sonic the Hedgehog", "Sega", "Megadrive");

    @Mock
    private GameCatalog gameCatalog;

    @Mock
    private MediaResolutionOrchestrator orchestrator;

    private MediaPrefetchService prefetchService;

    @BeforeEach
    void setUp() {
        AppConfigurationProperties properties = new AppConfigurationProperties();
        properties.getPrefetch().setMaxGamesPerRun(2);
        prefetchService = new MediaPrefetchService(gameCatalog, orchestrator, properties);
        given(gameCatalog.listGames()).willReturn(List.of(METROID, ZELDA, SONIC));
        given(orchestrator.resolve(any(GameKey.class), any(CompletenessPolicy.class), eq(false)))
            .willAnswer(invocation -> new MediaRecord(invocation.getArgument(0), List.of(), null, null, null, null));
    }

    @Test
    void resolvesOnlyIncompleteGamesWithDescriptionsRequired() {
        given(orchestrator.inspect(METROID.toKey(), POLICY)).willReturn(status(METROID, true));
        given(orchestrator.inspect(ZELDA.toKey(), POLICY)).willReturn(status(ZELDA, false));
        given(orchestrator.inspect(SONIC.toKey(), POLICY)).willReturn(status(SONIC, false));

        PrefetchSummary summary = prefetchService.prefetch(0);

        assertThat(summary).isEqualTo(new PrefetchSummary(3, 2, 1, 0));
        verify(orchestrator, never()).resolve(eq(METROID.toKey()), any(CompletenessPolicy.class), eq(false));
        verify(orchestrator).resolve(ZELDA.toKey(), POLICY, false);
        verify(orchestrator).resolve(SONIC.toKey(), POLICY, false);
    }

    @Test
    void stopsWhenTheResolutionBudgetIsUsed() {
        given(orchestrator.inspect(any(GameKey.class), eq(POLICY))).willAnswer(invocation ->
            CacheStatus.evaluate(invocation.getArgument(0), 0, 0, false, POLICY));

        PrefetchSummary summary = prefetchService.prefetch();

        assertThat(summary.resolved()).isEqualTo(2);
        verify(orchestrator, never()).inspect(SONIC.toKey(), POLICY);
    }

    @Test
    void storeFailuresAreCountedAndTheRunContinues() {
        given(orchestrator.inspect(METROID.toKey(), POLICY)).willThrow(new MediaStoreException("unreadable sidecar"));
        given(orchestrator.inspect(ZELDA.toKey(), POLICY)).willReturn(status(ZELDA, false));
        given(orchestrator.inspect(SONIC.toKey(), POLICY)).willReturn(status(SONIC, false));
        given(orchestrator.resolve(ZELDA.toKey(), POLICY, false)).willThrow(new MediaStoreException("disk full"));

        PrefetchSummary summary = prefetchService.prefetch(0);

        assertThat(summary).isEqualTo(new PrefetchSummary(3, 2, 0, 2));
        verify(orchestrator).resolve(SONIC.toKey(), POLICY, false);
    }

    @Test
    void emptyCatalogDoesNothing() {
        given(gameCatalog.listGames()).willReturn(List.of());

        assertThat(prefetchService.prefetch()).isEqualTo(new PrefetchSummary(0, 0, 0, 0));
        verify(orchestrator, never()).inspect(any(GameKey.class), any(CompletenessPolicy.class));
    }

    private static CacheStatus status(CatalogGame game, boolean complete) {
        return complete
            ? CacheStatus.evaluate(game.toKey(), 1, 4, true, POLICY)
            : CacheStatus.evaluate(game.toKey(), 0, 0, false, POLICY);
    }
}
