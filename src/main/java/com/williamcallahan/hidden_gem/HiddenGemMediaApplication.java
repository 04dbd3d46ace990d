/**
 * Main application class for the Hidden Gem media engine
 *
 * Features:
 * - Resolves, caches and maintains cover art, screenshots and descriptions of catalog games
 * - Supports asynchronous resolutions and scheduled catalog prefetch
 * - Command-line maintenance runs: {@code --media.prefetch[=max]} and {@code --media.clear-short-descriptions}
 */

package com.williamcallahan.hidden_gem;

import com.williamcallahan.hidden_gem.service.MediaMaintenanceService;
import com.williamcallahan.hidden_gem.service.MediaPrefetchService;
import com.williamcallahan.hidden_gem.service.PrefetchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.List;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class HiddenGemMediaApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(HiddenGemMediaApplication.class);

    private final MediaPrefetchService prefetchService;
    private final MediaMaintenanceService maintenanceService;

    public HiddenGemMediaApplication(MediaPrefetchService prefetchService,
                                     MediaMaintenanceService maintenanceService) {
        this.prefetchService = prefetchService;
        this.maintenanceService = maintenanceService;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(HiddenGemMediaApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        // Clear first so a combined run re-fetches the descriptions it just dropped
        if (args.containsOption("media.clear-short-descriptions")) {
            int removed = maintenanceService.clearShortProviderDescriptions();
            log.info("--media.clear-short-descriptions removed {} description(s)", removed);
        }

        if (args.containsOption("media.prefetch")) {
            int max = parseIntArg(args, "media.prefetch", 0);
            PrefetchSummary summary = max > 0 ? prefetchService.prefetch(max) : prefetchService.prefetch();
            log.info("--media.prefetch finished: {}", summary);
        }
    }

    private String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    private int parseIntArg(ApplicationArguments args, String name, int defaultValue) {
        String value = firstOptionValue(args, name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value '{}' for --{}", value, name);
            return defaultValue;
        }
    }
}
