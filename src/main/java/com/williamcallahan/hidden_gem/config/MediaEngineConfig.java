/**
 * Wiring for the media resolution engine
 * - One process-wide clock so quota resets and cooldowns can be tested
 * - One rate limiter shared by every resolution, registered from provider properties
 */

package com.williamcallahan.hidden_gem.config;

import com.williamcallahan.hidden_gem.service.ProviderRateLimiter;
import com.williamcallahan.hidden_gem.types.ProviderId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MediaEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRateLimiter providerRateLimiter(AppConfigurationProperties properties, Clock clock) {
        AppConfigurationProperties.Providers providers = properties.getProviders();
        return new ProviderRateLimiter(clock)
            .register(ProviderId.RAWG, providers.getRawg().getMinInterval(), providers.getRawg().getDailyLimit())
            .register(ProviderId.THE_GAMES_DB, providers.getThegamesdb().getMinInterval(), providers.getThegamesdb().getDailyLimit());
    }
}
