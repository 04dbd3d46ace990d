/**
 * Exception signalling that a media provider could not be reached or refused the request
 *
 * Features:
 * - Covers transport errors, timeouts, missing credentials and HTTP error statuses
 * - Flags HTTP 429 responses so the provider's quota can be closed until the next reset
 */
package com.williamcallahan.hidden_gem.exception;

import com.williamcallahan.hidden_gem.types.ProviderId;

public class ProviderUnavailableException extends RuntimeException {

    private final ProviderId providerId;
    private final boolean rateLimited;

    public ProviderUnavailableException(ProviderId providerId, String message) {
        this(providerId, message, false, null);
    }

    public ProviderUnavailableException(ProviderId providerId, String message, Throwable cause) {
        this(providerId, message, false, cause);
    }

    public ProviderUnavailableException(ProviderId providerId, String message, boolean rateLimited, Throwable cause) {
        super(providerId.getDisplayName() + ": " + message, cause);
        this.providerId = providerId;
        this.rateLimited = rateLimited;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
