/**
 * Capability interface of a third-party game media provider
 *
 * Features:
 * - Description lookup by title with a platform hint
 * - Image fetch bounded by the caller's remaining deficit
 * - Reactive return types so implementations can use WebClient without blocking
 */
package com.williamcallahan.hidden_gem.types;

import reactor.core.publisher.Mono;

import java.util.List;

public interface GameMediaProvider {

    ProviderId id();

    /**
     * Whether this provider takes part in resolutions at all
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Whether this provider can return descriptions at all
     */
    default boolean supportsDescriptions() {
        return true;
    }

    /**
     * Looks up a description
     *
     * @param title catalog title
     * @param platformHint console name, may be null
     * @return the description, or an empty Mono when nothing was found; never an error for "not found".
     *         Transport, authentication and rate limit failures are signalled as errors (typically
     *         {@code ProviderUnavailableException}) so circuit breakers and quotas see them; the resolution
     *         orchestrator records them and then treats the lookup as not found
     */
    Mono<String> searchDescription(String title, String platformHint);

    /**
     * Fetches images for a game
     *
     * @param title catalog title
     * @param platformHint console name, may be null
     * @param deficit how many covers and screenshots are still wanted; at most {@code deficit.total()}
     *                images are returned and covers only when {@code deficit.needsCover()}
     * @return zero or more images; an error (typically {@code ProviderUnavailableException}) only for
     *         transport or authentication failures
     */
    Mono<List<RawImage>> fetchImages(String title, String platformHint, ImageDeficit deficit);
}
