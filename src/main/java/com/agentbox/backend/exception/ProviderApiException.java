package com.agentbox.backend.exception;

import lombok.Getter;

/**
 * Non-2xx answer (or transport failure, status 0) from an outbound provider API.
 */
@Getter
public class ProviderApiException extends RuntimeException {
    private final String provider;
    private final int status;
    private final String body;

    public ProviderApiException(String provider, int status, String body) {
        super(provider + " API error " + status + ": " + body);
        this.provider = provider;
        this.status = status;
        this.body = body;
    }

    public ProviderApiException(String provider, String message, Throwable cause) {
        super(provider + " API call failed: " + message, cause);
        this.provider = provider;
        this.status = 0;
        this.body = message;
    }

    /** Location has no capacity for the requested server type. */
    public boolean isCapacityError() {
        return status == 412 && body != null && body.contains("resource_unavailable");
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
