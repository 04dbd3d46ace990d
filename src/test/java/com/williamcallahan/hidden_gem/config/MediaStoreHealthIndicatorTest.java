package com.williamcallahan.hidden_gem.config;

import com.williamcallahan.hidden_gem.repository.FileSystemMediaStore;
import com.williamcallahan.hidden_gem.service.ProviderRateLimiter;
import com.williamcallahan.hidden_gem.testutil.MediaFixtures;
import com.williamcallahan.hidden_gem.testutil.MutableClock;
import com.williamcallahan.hidden_gem.types.ProviderId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MediaStoreHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
    private final ProviderRateLimiter rateLimiter = new ProviderRateLimiter(clock)
        .register(ProviderId.RAWG, Duration.ofMillis(200), 600);

    @Test
    void upWhenTheMediaRootIsWritable() {
        FileSystemMediaStore store = MediaFixtures.store(tempDir.resolve("media"), clock);

        Health health = new MediaStoreHealthIndicator(store, rateLimiter).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("media_root", tempDir.resolve("media").toAbsolutePath().normalize().toString());
        assertThat(health.getDetails().get("provider_quotas").toString()).contains("RAWG");
    }

    @Test
    void downWhenTheMediaRootIsGone() throws Exception {
        Path root = tempDir.resolve("media");
        FileSystemMediaStore store = MediaFixtures.store(root, clock);
        Files.delete(root);

        assertThat(new MediaStoreHealthIndicator(store, rateLimiter).health().getStatus()).isEqualTo(Status.DOWN);
    }
}
