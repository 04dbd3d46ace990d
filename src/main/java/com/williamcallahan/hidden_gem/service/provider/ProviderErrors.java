package com.williamcallahan.hidden_gem.service.provider;

import com.williamcallahan.hidden_gem.exception.ProviderUnavailableException;
import com.williamcallahan.hidden_gem.types.ProviderId;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps low-level client failures to ProviderUnavailableException
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static ProviderUnavailableException translate(ProviderId provider, String operation, Throwable error) {
        if (error instanceof ProviderUnavailableException unavailable) {
            return unavailable;
        }
        if (error instanceof WebClientResponseException response) {
            if (response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return new ProviderUnavailableException(provider, operation + " was rate limited (HTTP 429)", true, error);
            }
            if (response.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                    || response.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                return new ProviderUnavailableException(provider, operation + " was refused, check the API key (HTTP "
                    + response.getStatusCode().value() + ")", error);
            }
            return new ProviderUnavailableException(provider, operation + " failed with HTTP "
                + response.getStatusCode().value(), error);
        }
        if (error instanceof CallNotPermittedException) {
            return new ProviderUnavailableException(provider, "circuit breaker is open", error);
        }
        if (error instanceof TimeoutException) {
            return new ProviderUnavailableException(provider, operation + " timed out", error);
        }
        return new ProviderUnavailableException(provider, operation + " failed: " + error.getMessage(), error);
    }

    static boolean isNotFound(Throwable error) {
        return error instanceof WebClientResponseException response
            && response.getStatusCode().value() == HttpStatus.NOT_FOUND.value();
    }
}
