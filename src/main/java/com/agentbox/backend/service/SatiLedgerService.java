package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.entity.enumeration.Asset;
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

import java.util.*;

/**
 * Identity registry and funding on Solana. Signing goes through the custodial signer;
 * read-only lookups use the public RPC.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class SatiLedgerService implements LedgerGateway {
    private static final Map<String, String> CAIP2_CHAIN_IDS = Map.of(
            "mainnet", "solana:5eykt4UsFv8P8NJdTREpY1vzqKqZKvdp",
            "devnet", "solana:EtWTRABZaYq6iMfeYKouRu166VU2xqa1");

    ApiStrategyFactory apiStrategyFactory;
    ObjectMapper objectMapper;

    @NonFinal
    @Value("${ledger.network:mainnet}")
    String network;

    private ApiStrategy signer() {
        return apiStrategyFactory.getStrategy(Constants.LEDGER.NAME_SERVICE);
    }

    private ApiStrategy rpc() {
        return apiStrategyFactory.getStrategy(Constants.LEDGER.RPC_SERVICE);
    }

    @Override
    public boolean isConfigured() {
        return apiStrategyFactory.isConfigured(Constants.LEDGER.NAME_SERVICE)
                && apiStrategyFactory.isConfigured(Constants.LEDGER.RPC_SERVICE);
    }

    @Override
    public String transfer(Asset asset, long amount, String to) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("asset", asset.symbol());
        body.put("amount", String.valueOf(amount));
        body.put("to", to);
        body.put("network", network);
        body.put("commitment", "confirmed");

        JsonNode res = parse(signer().callApi(HttpMethod.POST, Constants.LEDGER.ENDPOINT.TRANSFER, body));
        String signature = requireText(res, "signature");
        log.info("{} transfer of {} base units to {} confirmed: {}", asset.symbol(), amount, to, signature);
        return signature;
    }

    @Override
    public String uploadDescriptor(IdentityDescriptor descriptor) {
        JsonNode res = parse(signer().callApi(HttpMethod.POST, Constants.LEDGER.ENDPOINT.METADATA,
                buildRegistrationFile(descriptor)));
        return requireText(res, "uri");
    }

    @Override
    public String mintIdentity(IdentityDescriptor descriptor, String uri) {
        List<Map<String, String>> metadata = new ArrayList<>();
        descriptor.getAdditionalMetadata().forEach((k, v) -> metadata.add(Map.of("key", k, "value", v)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", descriptor.getName());
        body.put("uri", uri);
        body.put("nonTransferable", false);
        body.put("additionalMetadata", metadata);
        body.put("network", network);

        JsonNode res = parse(signer().callApi(HttpMethod.POST, Constants.LEDGER.ENDPOINT.IDENTITIES, body));
        return requireText(res, "mint");
    }

    @Override
    public void transferIdentity(String mint, String newOwner) {
        signer().callApi(HttpMethod.POST, Constants.LEDGER.ENDPOINT.IDENTITY_TRANSFER,
                Map.of("newOwner", newOwner), Map.of("mint", mint));
    }

    @Override
    public void updateIdentity(String mint, String name, String uri) {
        Map<String, Object> updates = new LinkedHashMap<>();
        if (name != null) updates.put("name", name);
        if (uri != null) updates.put("uri", uri);
        if (updates.isEmpty()) return;
        signer().callApi(HttpMethod.PATCH, Constants.LEDGER.ENDPOINT.IDENTITY, updates, Map.of("mint", mint));
    }

    @Override
    public Optional<IdentityDescriptor> loadIdentity(String mint) {
        JsonNode res;
        try {
            res = parse(signer().callApi(HttpMethod.GET, Constants.LEDGER.ENDPOINT.IDENTITY, null, Map.of("mint", mint)));
        } catch (ProviderApiException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
        IdentityDescriptor.IdentityDescriptorBuilder builder = IdentityDescriptor.builder()
                .name(res.path("name").asText(null));
        res.path("additionalMetadata").fields()
                .forEachRemaining(e -> builder.metadata(e.getKey(), e.getValue().asText()));
        return Optional.of(builder.build());
    }

    @Override
    public List<String> ownedTokensOf(String wallet) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", 1);
        request.put("method", "getTokenAccountsByOwner");
        request.put("params", List.of(
                wallet,
                Map.of("programId", Constants.LEDGER.TOKEN_2022_PROGRAM),
                Map.of("encoding", "jsonParsed")));

        JsonNode res = parse(rpc().callApi(HttpMethod.POST, "/", request));
        if (res.hasNonNull("error")) {
            throw new ProviderApiException(Constants.LEDGER.RPC_SERVICE, 200, res.path("error").toString());
        }

        Set<String> mints = new LinkedHashSet<>();
        for (JsonNode account : res.path("result").path("value")) {
            JsonNode info = account.path("account").path("data").path("parsed").path("info");
            String mint = info.path("mint").asText(null);
            JsonNode amount = info.path("tokenAmount");
            if (mint == null || amount.isMissingNode()) continue;
            if (!"1".equals(amount.path("amount").asText()) || amount.path("decimals").asInt(-1) != 0) continue;
            mints.add(mint);
        }
        return new ArrayList<>(mints);
    }

    private Map<String, Object> buildRegistrationFile(IdentityDescriptor d) {
        String chainId = CAIP2_CHAIN_IDS.getOrDefault(network, CAIP2_CHAIN_IDS.get("mainnet"));

        Map<String, Object> oasf = new LinkedHashMap<>();
        oasf.put("name", "OASF");
        oasf.put("endpoint", "https://github.com/agntcy/oasf/");
        oasf.put("version", "v0.8.0");
        oasf.put("skills", List.of(
                "natural_language_processing/natural_language_generation/dialogue_generation",
                "tool_interaction/tool_use_planning",
                "agent_orchestration/task_decomposition"));
        oasf.put("domains", List.of(
                "technology/software_engineering/apis_integration",
                "technology/blockchain/blockchain"));

        List<Map<String, Object>> services = new ArrayList<>();
        services.add(oasf);
        services.add(Map.of("name", "agentWallet", "endpoint", chainId + ":" + d.getAgentWallet()));
        services.add(Map.of("name", "web", "endpoint", "https://" + d.getHostname()));

        Map<String, Object> file = new LinkedHashMap<>();
        file.put("type", "https://eips.ethereum.org/EIPS/eip-8004#registration-v1");
        file.put("name", d.getName());
        file.put("description", d.getDescription());
        file.put("image", d.getImage());
        file.put("services", services);
        file.put("supportedTrust", List.of("reputation"));
        file.put("active", true);
        file.put("x402Support", true);
        return file;
    }

    private JsonNode parse(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderApiException(Constants.LEDGER.NAME_SERVICE, "unparseable response", e);
        }
    }

    private static String requireText(JsonNode res, String field) {
        String value = res.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new ProviderApiException(Constants.LEDGER.NAME_SERVICE, 200, "response has no " + field);
        }
        return value;
    }
}
