/**
 * Configuration for the reactive WebClient used by media providers
 * - Defines the shared WebClient builder
 * - Sets default timeouts and connection settings
 */
package com.williamcallahan.hidden_gem.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    static final String USER_AGENT = "HiddenGem/1.0 (retro game catalog media fetcher)";

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Sets read and write timeouts to 10 seconds, images can be large
     * - Raises the in-memory buffer to 10MB for image bodies
     * - Sends a descriptive User-Agent, some providers reject anonymous clients
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(10, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(10, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(10));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
