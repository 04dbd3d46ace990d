/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for type safety and IDE support
 */

package com.williamcallahan.hidden_gem.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Media media = new Media();

    @NestedConfigurationProperty
    private Providers providers = new Providers();

    @NestedConfigurationProperty
    private Catalog catalog = new Catalog();

    @NestedConfigurationProperty
    private Prefetch prefetch = new Prefetch();

    // Getters and setters
    public Media getMedia() { return media; }
    public void setMedia(Media media) { this.media = media; }

    public Providers getProviders() { return providers; }
    public void setProviders(Providers providers) { this.providers = providers; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public Prefetch getPrefetch() { return prefetch; }
    public void setPrefetch(Prefetch prefetch) { this.prefetch = prefetch; }

    // Nested configuration classes
    public static class Media {
        private String root = "static/images/games";
        private String publicUrlPrefix = "/static/images/games";
        private int defaultMaxImages = 5;
        private Duration resolveCooldown = Duration.ofHours(6);
        private Duration providerTimeout = Duration.ofSeconds(15);
        private boolean requireDescription = false;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }

        public String getPublicUrlPrefix() { return publicUrlPrefix; }
        public void setPublicUrlPrefix(String publicUrlPrefix) { this.publicUrlPrefix = publicUrlPrefix; }

        public int getDefaultMaxImages() { return defaultMaxImages; }
        public void setDefaultMaxImages(int defaultMaxImages) { this.defaultMaxImages = defaultMaxImages; }

        public Duration getResolveCooldown() { return resolveCooldown; }
        public void setResolveCooldown(Duration resolveCooldown) { this.resolveCooldown = resolveCooldown; }

        public Duration getProviderTimeout() { return providerTimeout; }
        public void setProviderTimeout(Duration providerTimeout) { this.providerTimeout = providerTimeout; }

        public boolean isRequireDescription() { return requireDescription; }
        public void setRequireDescription(boolean requireDescription) { this.requireDescription = requireDescription; }
    }

    public static class Providers {
        @NestedConfigurationProperty
        private Provider rawg = new Provider("https://api.rawg.io/api", Duration.ofMillis(200), 600);

        @NestedConfigurationProperty
        private Provider thegamesdb = new Provider("https://api.thegamesdb.net/v1", Duration.ofSeconds(1), 30);

        public Provider getRawg() { return rawg; }
        public void setRawg(Provider rawg) { this.rawg = rawg; }

        public Provider getThegamesdb() { return thegamesdb; }
        public void setThegamesdb(Provider thegamesdb) { this.thegamesdb = thegamesdb; }
    }

    public static class Provider {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private Duration minInterval;
        private int dailyLimit;

        public Provider() {
            this(null, Duration.ofMillis(200), 100);
        }

        public Provider(String baseUrl, Duration minInterval, int dailyLimit) {
            this.baseUrl = baseUrl;
            this.minInterval = minInterval;
            this.dailyLimit = dailyLimit;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public Duration getMinInterval() { return minInterval; }
        public void setMinInterval(Duration minInterval) { this.minInterval = minInterval; }

        public int getDailyLimit() { return dailyLimit; }
        public void setDailyLimit(int dailyLimit) { this.dailyLimit = dailyLimit; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Catalog {
        private String file = "games.tsv";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    public static class Prefetch {
        private boolean enabled = false;
        private String cron = "0 0 4 * * ?";
        private int maxGamesPerRun = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public int getMaxGamesPerRun() { return maxGamesPerRun; }
        public void setMaxGamesPerRun(int maxGamesPerRun) { this.maxGamesPerRun = maxGamesPerRun; }
    }
}
