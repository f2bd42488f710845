package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.exception.ProviderApiException;
import com.agentbox.backend.webClient.ApiStrategy;
import com.agentbox.backend.webClient.ApiStrategyFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class CloudflareService implements DnsGateway {
    ApiStrategyFactory apiStrategyFactory;
    ObjectMapper objectMapper;

    @NonFinal
    @Value("${cloudflare.zone-id:}")
    String zoneId;

    private ApiStrategy api() {
        return apiStrategyFactory.getStrategy(Constants.CLOUDFLARE.NAME_SERVICE);
    }

    @Override
    public boolean isConfigured() {
        return apiStrategyFactory.isConfigured(Constants.CLOUDFLARE.NAME_SERVICE);
    }

    @Override
    public void createRecord(String hostname, String ip) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "A");
        body.put("name", hostname);
        body.put("content", ip);
        body.put("ttl", Constants.CLOUDFLARE.RECORD_TTL);
        body.put("proxied", false);

        JsonNode res = parse(api().callApi(HttpMethod.POST, Constants.CLOUDFLARE.ENDPOINT.DNS_RECORDS, body,
                Map.of("zoneId", zoneId)));
        requireSuccess(res, "create");
        log.info("DNS A record {} -> {} created", hostname, ip);
    }

    @Override
    public void deleteRecord(String hostname) {
        JsonNode found = parse(api().callApi(HttpMethod.GET,
                Constants.CLOUDFLARE.ENDPOINT.DNS_RECORDS + "?type=A&name={name}", null,
                Map.of("zoneId", zoneId, "name", hostname)));
        requireSuccess(found, "search");

        for (JsonNode record : found.path("result")) {
            String recordId = record.path("id").asText();
            try {
                api().callApi(HttpMethod.DELETE, Constants.CLOUDFLARE.ENDPOINT.DNS_RECORD, null,
                        Map.of("zoneId", zoneId, "recordId", recordId));
            } catch (ProviderApiException e) {
                if (!e.isNotFound()) throw e;
            }
        }
        log.info("DNS records for {} removed ({} found)", hostname, found.path("result").size());
    }

    private void requireSuccess(JsonNode res, String op) {
        if (!res.path("success").asBoolean(false)) {
            StringBuilder errors = new StringBuilder();
            for (JsonNode err : res.path("errors")) {
                if (errors.length() > 0) errors.append(", ");
                errors.append(err.path("message").asText());
            }
            throw new ProviderApiException(Constants.CLOUDFLARE.NAME_SERVICE, 200, "DNS " + op + " failed: " + errors);
        }
    }

    private JsonNode parse(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderApiException(Constants.CLOUDFLARE.NAME_SERVICE, "unparseable response", e);
        }
    }
}
