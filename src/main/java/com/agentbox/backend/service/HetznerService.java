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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class HetznerService implements VmGateway {
    ApiStrategyFactory apiStrategyFactory;
    ObjectMapper objectMapper;

    @NonFinal
    @Value("${hetzner.snapshot-id:}")
    String snapshotId;

    @NonFinal
    @Value("${hetzner.server-type:cx33}")
    String serverType;

    @NonFinal
    @Value("${hetzner.locations:nbg1,fsn1}")
    String locations;

    @NonFinal
    @Value("${hetzner.ssh-key-ids:}")
    String sshKeyIds;

    private ApiStrategy api() {
        return apiStrategyFactory.getStrategy(Constants.HETZNER.NAME_SERVICE);
    }

    @Override
    public boolean isConfigured() {
        return apiStrategyFactory.isConfigured(Constants.HETZNER.NAME_SERVICE) && snapshotId != null && !snapshotId.isBlank();
    }

    @Override
    public List<String> locations() {
        return splitCsv(locations);
    }

    @Override
    public CreatedServer createServer(String name, String userData, String location) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("server_type", serverType);
        body.put("image", Long.parseLong(snapshotId.trim()));
        body.put("location", location);
        body.put("start_after_create", true);
        body.put("user_data", userData);
        List<Long> keys = splitCsv(sshKeyIds).stream().map(Long::parseLong).toList();
        if (!keys.isEmpty()) {
            body.put("ssh_keys", keys);
        }

        JsonNode json = parse(api().callApi(HttpMethod.POST, Constants.HETZNER.ENDPOINT.SERVERS, body));
        JsonNode server = json.path("server");
        return CreatedServer.builder()
                .id(server.path("id").asLong())
                .ip(server.path("public_net").path("ipv4").path("ip").asText())
                .rootPassword(json.path("root_password").asText(null))
                .location(location)
                .snapshotId(snapshotId.trim())
                .build();
    }

    @Override
    public Optional<String> getServerStatus(long serverId) {
        try {
            String raw = api().callApi(HttpMethod.GET, Constants.HETZNER.ENDPOINT.SERVER, null, Map.of("id", serverId));
            return Optional.ofNullable(parse(raw).path("server").path("status").asText(null));
        } catch (ProviderApiException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    @Override
    public void deleteServer(long serverId) {
        try {
            api().callApi(HttpMethod.DELETE, Constants.HETZNER.ENDPOINT.SERVER, null, Map.of("id", serverId));
            log.info("Hetzner server {} deleted", serverId);
        } catch (ProviderApiException e) {
            if (!e.isNotFound()) throw e;
            log.info("Hetzner server {} already gone", serverId);
        }
    }

    @Override
    public void rebootServer(long serverId) {
        api().callApi(HttpMethod.POST, Constants.HETZNER.ENDPOINT.REBOOT, null, Map.of("id", serverId));
    }

    private JsonNode parse(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderApiException(Constants.HETZNER.NAME_SERVICE, "unparseable response", e);
        }
    }

    private static List<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
