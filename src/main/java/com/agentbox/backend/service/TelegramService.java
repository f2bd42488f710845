package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.exception.ProviderApiException;
import com.agentbox.backend.webClient.ApiStrategyFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class TelegramService implements ChannelGateway {
    private static final Pattern BOT_TOKEN = Pattern.compile("^\\d{5,16}:[A-Za-z0-9_-]{30,}$");

    ApiStrategyFactory apiStrategyFactory;
    ObjectMapper objectMapper;

    @Override
    public String resolveBotUsername(String botToken) {
        if (botToken == null || !BOT_TOKEN.matcher(botToken).matches()) {
            throw new AppException(ErrorCode.INVALID_CHANNEL_TOKEN);
        }
        try {
            String raw = apiStrategyFactory.getStrategy(Constants.TELEGRAM.NAME_SERVICE)
                    .callApi(HttpMethod.GET, Constants.TELEGRAM.ENDPOINT.GET_ME, null, Map.of("token", botToken));
            JsonNode res = objectMapper.readTree(raw);
            String username = res.path("result").path("username").asText(null);
            if (!res.path("ok").asBoolean(false) || username == null) {
                throw new AppException(ErrorCode.INVALID_CHANNEL_TOKEN);
            }
            return username;
        } catch (ProviderApiException e) {
            if (e.getStatus() == 401 || e.getStatus() == 404) {
                throw new AppException(ErrorCode.INVALID_CHANNEL_TOKEN);
            }
            throw new AppException(ErrorCode.UPSTREAM_FAILED, e);
        } catch (JsonProcessingException e) {
            throw new AppException(ErrorCode.UPSTREAM_FAILED, e);
        }
    }

    @Override
    public void clearSubscription(String botToken) {
        try {
            apiStrategyFactory.getStrategy(Constants.TELEGRAM.NAME_SERVICE)
                    .callApi(HttpMethod.POST, Constants.TELEGRAM.ENDPOINT.DELETE_WEBHOOK, null, Map.of("token", botToken));
        } catch (ProviderApiException e) {
            log.warn("Failed to clear bot webhook: {}", e.getMessage());
        }
    }
}
