package com.williamcallahan.hidden_gem.scheduler;

import com.williamcallahan.hidden_gem.service.MediaPrefetchService;
import com.williamcallahan.hidden_gem.service.PrefetchSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MediaPrefetchSchedulerTest {

    @Mock
    private MediaPrefetchService prefetchService;

    private MediaPrefetchScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new MediaPrefetchScheduler(prefetchService);
    }

    @Test
    void doesNothingWhenDisabled() {
        scheduler.setPrefetchEnabled(false);

        scheduler.prefetchCatalogMedia();

        verify(prefetchService, never()).prefetchAsync();
    }

    @Test
    void skipsARunWhileThePreviousOneIsStillGoing() {
        CompletableFuture<PrefetchSummary> pending = new CompletableFuture<>();
        given(prefetchService.prefetchAsync()).willReturn(pending);
        scheduler.setPrefetchEnabled(true);

        scheduler.prefetchCatalogMedia();
        scheduler.prefetchCatalogMedia();

        verify(prefetchService, times(1)).prefetchAsync();
        assertThat(scheduler.isRunning()).isTrue();

        pending.complete(new PrefetchSummary(3, 1, 2, 0));
        assertThat(scheduler.isRunning()).isFalse();

        scheduler.prefetchCatalogMedia();
        verify(prefetchService, times(2)).prefetchAsync();
    }

    @Test
    void failedRunReleasesTheGuard() {
        given(prefetchService.prefetchAsync())
            .willReturn(CompletableFuture.failedFuture(new IllegalStateException("catalog unreadable")));
        scheduler.setPrefetchEnabled(true);

        scheduler.prefetchCatalogMedia();

        assertThat(scheduler.isRunning()).isFalse();
    }
}
