package com.agentbox.backend.webClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up the client for one upstream provider (servers, DNS, ledger signer, chain RPC, channel).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiStrategyFactory {
    private final List<ApiStrategy> strategies;
    private final Map<String, ApiStrategy> resolved = new ConcurrentHashMap<>();

    public ApiStrategy getStrategy(String provider) {
        return resolved.computeIfAbsent(provider, key -> strategies.stream()
                .filter(strategy -> strategy.isApplicable(key))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No upstream client registered for provider: " + key)));
    }

    public boolean isConfigured(String provider) {
        try {
            return getStrategy(provider).isConfigured();
        } catch (IllegalStateException e) {
            log.warn("Provider {} has no client: {}", provider, e.getMessage());
            return false;
        }
    }
}
