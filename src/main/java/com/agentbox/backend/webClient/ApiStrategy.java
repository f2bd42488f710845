package com.agentbox.backend.webClient;

import org.springframework.http.HttpMethod;

import java.util.Map;

public interface ApiStrategy {
    boolean isApplicable(String serviceType);

    /** False when the credentials or base URL for this provider are missing. */
    boolean isConfigured();

    default String callApi(HttpMethod method, String endpoint, Object requestBody) {
        return callApi(method, endpoint, requestBody, Map.of());
    }

    /**
     * Calls the provider and returns the raw response body.
     *
     * @throws com.agentbox.backend.exception.ProviderApiException on a non-2xx answer or transport failure
     */
    String callApi(HttpMethod method, String endpoint, Object requestBody, Map<String, ?> uriVariables);
}
