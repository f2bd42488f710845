package com.agentbox.backend.webClient;

import com.agentbox.backend.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class CloudflareApiStrategy extends AbstractApiStrategy {
    private final String apiToken;
    private final String zoneId;

    public CloudflareApiStrategy(WebClient.Builder builder,
                                 @Value("${cloudflare.url:https://api.cloudflare.com/client/v4}") String url,
                                 @Value("${cloudflare.api-token:}") String apiToken,
                                 @Value("${cloudflare.zone-id:}") String zoneId) {
        super(builder, Constants.CLOUDFLARE.NAME_SERVICE, url, Duration.ofSeconds(30));
        this.apiToken = apiToken;
        this.zoneId = zoneId;
    }

    @Override
    public boolean isConfigured() {
        return apiToken != null && !apiToken.isBlank() && zoneId != null && !zoneId.isBlank();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(apiToken);
    }
}
