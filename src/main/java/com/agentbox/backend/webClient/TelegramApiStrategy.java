package com.agentbox.backend.webClient;

import com.agentbox.backend.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/** Bot API; the bot token travels in the path. */
@Component
public class TelegramApiStrategy extends AbstractApiStrategy {

    public TelegramApiStrategy(WebClient.Builder builder,
                               @Value("${telegram.api-url:https://api.telegram.org}") String apiUrl) {
        super(builder, Constants.TELEGRAM.NAME_SERVICE, apiUrl, Duration.ofSeconds(15));
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        // token is part of the URI
    }
}
