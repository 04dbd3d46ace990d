/**
 * Health indicator for the media store
 *
 * Reports DOWN when the media root is missing or not writable, and lists provider quota state
 */

package com.williamcallahan.hidden_gem.config;

import com.williamcallahan.hidden_gem.repository.FileSystemMediaStore;
import com.williamcallahan.hidden_gem.service.ProviderRateLimiter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

@Component("mediaStoreHealthIndicator")
public class MediaStoreHealthIndicator implements HealthIndicator {

    private final FileSystemMediaStore mediaStore;
    private final ProviderRateLimiter rateLimiter;

    public MediaStoreHealthIndicator(FileSystemMediaStore mediaStore, ProviderRateLimiter rateLimiter) {
        this.mediaStore = mediaStore;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Health health() {
        Path root = mediaStore.getRoot();
        Health.Builder builder = Files.isDirectory(root) && Files.isWritable(root) ? Health.up() : Health.down();
        return builder
            .withDetail("media_root", root.toString())
            .withDetail("provider_quotas", rateLimiter.getStatus())
            .build();
    }
}
