package com.agentbox.backend.webClient;

import com.agentbox.backend.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class HetznerApiStrategy extends AbstractApiStrategy {
    private final String apiToken;

    public HetznerApiStrategy(WebClient.Builder builder,
                              @Value("${hetzner.url:https://api.hetzner.cloud/v1}") String url,
                              @Value("${hetzner.api-token:}") String apiToken) {
        super(builder, Constants.HETZNER.NAME_SERVICE, url, Duration.ofSeconds(60));
        this.apiToken = apiToken;
    }

    @Override
    public boolean isConfigured() {
        return apiToken != null && !apiToken.isBlank();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(apiToken);
    }
}
