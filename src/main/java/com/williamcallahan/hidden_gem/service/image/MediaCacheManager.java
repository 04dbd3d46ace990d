package com.williamcallahan.hidden_gem.service.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * In-memory Caffeine caches shared by the provider clients
 * - Remembers image URLs that failed to download so they are not retried for a day
 * - Remembers provider search matches for an hour so description and image lookups share one search
 */
@Service
public class MediaCacheManager {

    private static final int MAX_BAD_URLS = 5000;
    private static final int MAX_GAME_LOOKUPS = 2000;

    private final Cache<String, Boolean> knownBadImageUrls;
    private final Cache<String, JsonNode> providerSearchResults;

    public MediaCacheManager() {
        this.knownBadImageUrls = Caffeine.newBuilder()
                .maximumSize(MAX_BAD_URLS)
                .expireAfterWrite(24, TimeUnit.HOURS)
                .build();

        this.providerSearchResults = Caffeine.newBuilder()
                .maximumSize(MAX_GAME_LOOKUPS)
                .expireAfterWrite(1, TimeUnit.HOURS)
                .build();
    }

    public boolean isKnownBadImageUrl(String imageUrl) {
        return imageUrl != null && knownBadImageUrls.getIfPresent(imageUrl) != null;
    }

    public void addKnownBadImageUrl(String imageUrl) {
        if (imageUrl != null) {
            knownBadImageUrls.put(imageUrl, Boolean.TRUE);
        }
    }

    /**
     * Cached provider search match for a lookup key such as {@code "RAWG|chrono trigger|SNES"}
     */
    public Optional<JsonNode> getSearchResult(String lookupKey) {
        return Optional.ofNullable(providerSearchResults.getIfPresent(lookupKey));
    }

    public void putSearchResult(String lookupKey, JsonNode game) {
        providerSearchResults.put(lookupKey, game);
    }

    /**
     * Titles are compared case-insensitively, so the key uses the trimmed lower-case title
     */
    public static String lookupKey(String provider, String title, String platformHint) {
        return provider + "|" + title.strip().toLowerCase(Locale.ROOT) + "|" + (platformHint == null ? "" : platformHint);
    }
}
