/**
 * Downloads provider images into memory
 *
 * Features:
 * - Accepts only responses with an image content type
 * - Skips URLs that failed recently instead of hammering broken CDNs
 * - Fills at most the requested number of covers and screenshots, trying candidates in order
 * - A single failed download never fails the batch
 */
package com.williamcallahan.hidden_gem.service.image;

import com.williamcallahan.hidden_gem.types.ImageCandidate;
import com.williamcallahan.hidden_gem.types.ImageCategory;
import com.williamcallahan.hidden_gem.types.ImageDeficit;
import com.williamcallahan.hidden_gem.types.ProviderId;
import com.williamcallahan.hidden_gem.types.RawImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;

@Service
public class ImageDownloader {

    private static final Logger logger = LoggerFactory.getLogger(ImageDownloader.class);
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final MediaCacheManager cacheManager;

    public ImageDownloader(WebClient.Builder webClientBuilder, MediaCacheManager cacheManager) {
        this.webClient = webClientBuilder.clone().build();
        this.cacheManager = cacheManager;
    }

    /**
     * Downloads candidates in order until the deficit is covered or the candidates run out
     *
     * @param provider provider the candidates came from
     * @param candidates named and categorized image URLs in preference order
     * @param deficit how many covers and screenshots are wanted
     * @return successfully downloaded images, never more than the deficit allows per category
     */
    public Mono<List<RawImage>> downloadAll(ProviderId provider, List<ImageCandidate> candidates, ImageDeficit deficit) {
        if (deficit.isZero() || candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        int[] remaining = {deficit.coversNeeded(), deficit.screenshotsNeeded()};
        return Flux.fromIterable(candidates)
            .filter(candidate -> !cacheManager.isKnownBadImageUrl(candidate.url()))
            .concatMap(candidate -> Mono.defer(() -> {
                int slot = candidate.category() == ImageCategory.COVER ? 0 : 1;
                if (remaining[slot] <= 0) {
                    return Mono.<RawImage>empty();
                }
                return download(candidate.url())
                    .map(bytes -> {
                        remaining[slot]--;
                        return new RawImage(candidate.filename(), bytes, provider, candidate.url());
                    });
            }))
            .take(deficit.total())
            .collectList();
    }

    /**
     * Downloads one image
     *
     * @return the bytes, or an empty Mono when the URL is broken, not an image or too slow
     */
    public Mono<byte[]> download(String url) {
        if (url == null || url.isBlank() || cacheManager.isKnownBadImageUrl(url)) {
            return Mono.empty();
        }
        return webClient.get()
            .uri(URI.create(url))
            .accept(MediaType.ALL)
            .retrieve()
            .toEntity(byte[].class)
            .timeout(DOWNLOAD_TIMEOUT)
            .flatMap(entity -> {
                MediaType contentType = entity.getHeaders().getContentType();
                byte[] body = entity.getBody();
                if (contentType == null || !"image".equalsIgnoreCase(contentType.getType())) {
                    logger.debug("Rejecting {}: content type {} is not an image", url, contentType);
                    cacheManager.addKnownBadImageUrl(url);
                    return Mono.empty();
                }
                if (body == null || body.length == 0) {
                    cacheManager.addKnownBadImageUrl(url);
                    return Mono.empty();
                }
                return Mono.just(body);
            })
            .onErrorResume(e -> {
                logger.warn("Image download failed for {}: {}", url, e.getMessage());
                cacheManager.addKnownBadImageUrl(url);
                return Mono.empty();
            });
    }
}
