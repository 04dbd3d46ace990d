package com.williamcallahan.hidden_gem.service.image;

import com.williamcallahan.hidden_gem.testutil.StubExchange;
import com.williamcallahan.hidden_gem.types.ImageCandidate;
import com.williamcallahan.hidden_gem.types.ImageCategory;
import com.williamcallahan.hidden_gem.types.ImageDeficit;
import com.williamcallahan.hidden_gem.types.ProviderId;
import com.williamcallahan.hidden_gem.types.RawImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageDownloaderTest {

    private static final String HOST = "https://img.test";

    private MediaCacheManager cacheManager;
    private StubExchange exchange;
    private ImageDownloader downloader;

    @BeforeEach
    void setUp() {
        cacheManager = new MediaCacheManager();
        exchange = new StubExchange(ImageDownloaderTest::route);
        downloader = new ImageDownloader(exchange.builder(), cacheManager);
    }

    @Test
    void downloadsNoMoreThanTheDeficitPerCategory() {
        List<ImageCandidate> candidates = List.of(
            cover("/cover-a.jpg"),
            cover("/cover-b.jpg"),
            screenshot("/shot-1.jpg"),
            screenshot("/shot-2.jpg"),
            screenshot("/shot-3.jpg"));

        List<RawImage> images = downloader.downloadAll(ProviderId.THE_GAMES_DB, candidates, new ImageDeficit(1, 2)).block();

        assertThat(images).extracting(RawImage::filename)
            .containsExactly("cover-a.jpg", "shot-1.jpg", "shot-2.jpg");
        assertThat(images).extracting(RawImage::sourceUrl).first().isEqualTo(HOST + "/cover-a.jpg");
        assertThat(exchange.requests()).noneMatch(uri -> uri.getPath().equals("/cover-b.jpg"));
        assertThat(exchange.requests()).noneMatch(uri -> uri.getPath().equals("/shot-3.jpg"));
    }

    @Test
    void failedDownloadsAreSkippedInFavorOfLaterCandidates() {
        List<ImageCandidate> candidates = List.of(
            screenshot("/missing.jpg"),
            screenshot("/page.jpg"),
            screenshot("/empty.jpg"),
            screenshot("/shot-1.jpg"));

        List<RawImage> images = downloader.downloadAll(ProviderId.RAWG, candidates, new ImageDeficit(0, 1)).block();

        assertThat(images).extracting(RawImage::filename).containsExactly("shot-1.jpg");
        assertThat(cacheManager.isKnownBadImageUrl(HOST + "/missing.jpg")).isTrue();
        assertThat(cacheManager.isKnownBadImageUrl(HOST + "/page.jpg")).isTrue();
        assertThat(cacheManager.isKnownBadImageUrl(HOST + "/empty.jpg")).isTrue();
        assertThat(cacheManager.isKnownBadImageUrl(HOST + "/shot-1.jpg")).isFalse();
    }

    @Test
    void knownBadUrlsAreNotRequestedAgain() {
        cacheManager.addKnownBadImageUrl(HOST + "/shot-1.jpg");

        StepVerifier.create(downloader.download(HOST + "/shot-1.jpg")).verifyComplete();
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void returnsTheImageBytes() {
        StepVerifier.create(downloader.download(HOST + "/shot-1.jpg").map(bytes -> new String(bytes, StandardCharsets.UTF_8)))
            .expectNext("/shot-1.jpg")
            .verifyComplete();
    }

    @Test
    void zeroDeficitDownloadsNothing() {
        StepVerifier.create(downloader.downloadAll(ProviderId.RAWG, List.of(cover("/cover-a.jpg")), new ImageDeficit(0, 0)))
            .expectNext(List.of())
            .verifyComplete();
        assertThat(exchange.requests()).isEmpty();
    }

    private static ImageCandidate cover(String path) {
        return new ImageCandidate(HOST + path, path.substring(1), ImageCategory.COVER);
    }

    private static ImageCandidate screenshot(String path) {
        return new ImageCandidate(HOST + path, path.substring(1), ImageCategory.SCREENSHOT);
    }

    private static ClientResponse route(ClientRequest request) {
        return switch (request.url().getPath()) {
            case "/missing.jpg" -> StubExchange.status(HttpStatus.NOT_FOUND);
            case "/page.jpg" -> StubExchange.html("<html>not here</html>");
            case "/empty.jpg" -> StubExchange.image(new byte[0]);
            default -> StubExchange.image(request.url().getPath().getBytes(StandardCharsets.UTF_8));
        };
    }
}
