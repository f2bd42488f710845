package com.agentbox.backend.service;

import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.dto.request.CreateInstanceRequest;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.exception.ProviderApiException;
import com.agentbox.backend.repository.InstanceRepository;
import com.agentbox.backend.utils.CredentialCrypto;
import com.agentbox.backend.utils.HostnameResolver;
import com.agentbox.backend.utils.TokenGenerator;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Creates instances: name allocation, channel validation, VM creation with location
 * fallback, DNS, then the row. No row is written unless the VM exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ProvisionOrchestratorService {
    static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]{1,61}[a-z0-9]$");
    static final int NAME_ATTEMPTS = 5;

    InstanceRepository instanceRepository;
    VmGateway vmGateway;
    DnsGateway dnsGateway;
    ChannelGateway channelGateway;
    EventRecorder eventRecorder;
    CredentialCrypto credentialCrypto;
    TokenGenerator tokenGenerator;
    HostnameResolver hostnameResolver;
    BootstrapScriptBuilder bootstrapScriptBuilder;

    @NonFinal
    @Value("${agentbox.api-base-url:http://localhost:8080}")
    String apiBaseUrl;

    @NonFinal
    @Value("${agentbox.instance-ttl-days:7}")
    long instanceTtlDays;

    public Instance create(CallerIdentity caller, CreateInstanceRequest request) {
        if (!vmGateway.isConfigured()) {
            throw new AppException(ErrorCode.UPSTREAM_NOT_CONFIGURED, "VM provider");
        }

        String name = allocateName(request.getName());

        String botToken = blankToNull(request.getTelegramBotToken());
        String botUsername = null;
        if (botToken != null) {
            botUsername = channelGateway.resolveBotUsername(botToken);
            channelGateway.clearSubscription(botToken);
        }

        String hostname = hostnameResolver.hostnameOf(name);
        String callbackToken = tokenGenerator.secret();
        String gatewayToken = tokenGenerator.secret();
        String terminalToken = tokenGenerator.secret();

        String userData = bootstrapScriptBuilder.build(BootstrapScriptBuilder.BootstrapParams.builder()
                .apiBaseUrl(stripTrailingSlash(apiBaseUrl))
                .callbackToken(callbackToken)
                .hostname(hostname)
                .gatewayToken(gatewayToken)
                .terminalToken(terminalToken)
                .build());

        VmGateway.CreatedServer server = createWithFallback(caller, name, userData);

        if (dnsGateway.isConfigured()) {
            try {
                dnsGateway.createRecord(hostname, server.getIp());
            } catch (Exception e) {
                log.warn("DNS record for {} ({}) not created: {}", hostname, server.getId(), e.getMessage());
            }
        } else {
            log.debug("DNS provider not configured, skipping record for {}", hostname);
        }

        Instant now = Instant.now();
        Instance instance = Instance.builder()
                .id(server.getId())
                .name(name)
                .ownerWallet(caller.getName())
                .status(InstanceStatus.PROVISIONING)
                .provisioningStep(ProvisioningStep.VM_CREATED)
                .ip(server.getIp())
                .gatewayToken(gatewayToken)
                .terminalToken(terminalToken)
                .callbackToken(callbackToken)
                .telegramBotToken(botToken == null ? null : credentialCrypto.encrypt(botToken))
                .telegramBotUsername(botUsername)
                .rootPassword(server.getRootPassword() == null ? null : credentialCrypto.encrypt(server.getRootPassword()))
                .snapshotId(server.getSnapshotId())
                .location(server.getLocation())
                .createdAt(now)
                .expiresAt(now.plus(instanceTtlDays, ChronoUnit.DAYS))
                .build();

        try {
            instance = instanceRepository.save(instance);
        } catch (RuntimeException e) {
            log.error("Server {} created but row insert failed, removing server", server.getId(), e);
            try {
                vmGateway.deleteServer(server.getId());
            } catch (Exception cleanup) {
                log.error("Orphaned server {} could not be removed: {}", server.getId(), cleanup.getMessage());
            }
            eventRecorder.record(EventType.INSTANCE_CREATE_FAILED, caller, server.getId(),
                    Map.of("error", "row insert failed: " + e.getMessage()));
            throw e;
        }

        eventRecorder.record(EventType.INSTANCE_CREATED, caller, instance.getId(), Map.of(
                "name", instance.getName(),
                "ownerWallet", instance.getOwnerWallet(),
                "ip", instance.getIp(),
                "expiresAt", instance.getExpiresAt().toString(),
                "location", String.valueOf(instance.getLocation())));
        log.info("Instance {} ({}) created for {} in {}", instance.getId(), name, caller.getName(), server.getLocation());
        return instance;
    }

    String allocateName(String requested) {
        if (requested != null) {
            if (!NAME_PATTERN.matcher(requested).matches()) {
                throw new AppException(ErrorCode.INVALID_INSTANCE_NAME);
            }
            if (instanceRepository.existsByNameAndStatusNot(requested, InstanceStatus.DELETED)) {
                throw new AppException(ErrorCode.INSTANCE_NAME_TAKEN);
            }
            return requested;
        }
        for (int attempt = 0; attempt < NAME_ATTEMPTS; attempt++) {
            String candidate = tokenGenerator.instanceName();
            if (!instanceRepository.existsByNameAndStatusNot(candidate, InstanceStatus.DELETED)) {
                return candidate;
            }
            log.debug("Generated name {} collides, retrying", candidate);
        }
        throw new AppException(ErrorCode.NAME_ALLOCATION_FAILED);
    }

    private VmGateway.CreatedServer createWithFallback(CallerIdentity caller, String name, String userData) {
        List<String> locations = vmGateway.locations();
        for (String location : locations) {
            try {
                VmGateway.CreatedServer server = vmGateway.createServer(name, userData, location);
                if (!location.equals(locations.get(0))) {
                    log.info("Server {} created in fallback location {}", name, location);
                }
                return server;
            } catch (ProviderApiException e) {
                if (!e.isCapacityError()) {
                    log.error("VM create for {} failed in {}: {}", name, location, e.getMessage());
                    eventRecorder.record(EventType.INSTANCE_CREATE_FAILED, caller, null,
                            Map.of("error", String.valueOf(e.getMessage()), "name", name, "location", location));
                    throw new AppException(ErrorCode.UPSTREAM_FAILED, "VM provider");
                }
                log.warn("Location {} has no capacity for {}, trying next", location, name);
            }
        }
        eventRecorder.record(EventType.INSTANCE_CREATE_FAILED, caller, null,
                Map.of("error", "no capacity in " + String.join(", ", locations), "name", name));
        throw new AppException(ErrorCode.UPSTREAM_FAILED, "no capacity in any location");
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
