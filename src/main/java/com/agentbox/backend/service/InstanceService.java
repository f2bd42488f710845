package com.agentbox.backend.service;

import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.configuration.InstanceSecurity;
import com.agentbox.backend.dto.request.CreateInstanceRequest;
import com.agentbox.backend.dto.request.RenameInstanceRequest;
import com.agentbox.backend.dto.request.UpdateAgentRequest;
import com.agentbox.backend.dto.request.UpdateTelegramRequest;
import com.agentbox.backend.dto.request.WithdrawRequest;
import com.agentbox.backend.dto.response.InstanceAccessResponse;
import com.agentbox.backend.dto.response.InstanceHealthResponse;
import com.agentbox.backend.dto.response.InstanceResponse;
import com.agentbox.backend.dto.response.SyncResponse;
import com.agentbox.backend.dto.response.WithdrawResponse;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.mapper.InstanceMapper;
import com.agentbox.backend.repository.InstanceRepository;
import com.agentbox.backend.utils.CredentialCrypto;
import com.agentbox.backend.utils.HostnameResolver;
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

/**
 * Owner-facing instance operations. Lookups answer 404 before ownership is checked, and
 * every state change goes through a conditional update rather than a full-row save.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class InstanceService {
    InstanceRepository instanceRepository;
    InstanceMapper instanceMapper;
    InstanceSecurity instanceSecurity;
    ProvisionOrchestratorService provisionOrchestratorService;
    MintAndFinalizeService mintAndFinalizeService;
    InstanceTeardownService instanceTeardownService;
    ReconciliationService reconciliationService;
    SessionBridgeService sessionBridgeService;
    VmGateway vmGateway;
    DnsGateway dnsGateway;
    ChannelGateway channelGateway;
    EventRecorder eventRecorder;
    CredentialCrypto credentialCrypto;
    HostnameResolver hostnameResolver;

    @NonFinal
    @Value("${agentbox.extension-days:7}")
    long extensionDays;

    @NonFinal
    @Value("${agentbox.max-lifetime-days:90}")
    long maxLifetimeDays;

    public InstanceResponse create(CreateInstanceRequest request) {
        CallerIdentity caller = instanceSecurity.currentCaller();
        return toResponse(provisionOrchestratorService.create(caller, request));
    }

    public List<InstanceResponse> list(boolean all) {
        CallerIdentity caller = instanceSecurity.currentCaller();
        List<Instance> rows = all && instanceSecurity.isAdmin(caller)
                ? instanceRepository.findAllByStatusNotOrderByCreatedAtDesc(InstanceStatus.DELETED)
                : instanceRepository.findAllByOwnerWalletAndStatusNotOrderByCreatedAtDesc(caller.getName(), InstanceStatus.DELETED);
        return rows.stream().map(this::toResponse).toList();
    }

    public List<InstanceResponse> expiring(int days, boolean all) {
        if (days < 1 || days > maxLifetimeDays) {
            throw new AppException(ErrorCode.INVALID_EXPIRING_WINDOW);
        }
        CallerIdentity caller = instanceSecurity.currentCaller();
        String owner = all && instanceSecurity.isAdmin(caller) ? null : caller.getName();
        Instant cutoff = Instant.now().plus(days, ChronoUnit.DAYS);
        return instanceRepository.findExpiring(cutoff, owner, InstanceStatus.DELETED).stream()
                .map(this::toResponse)
                .toList();
    }

    public InstanceResponse get(Long id) {
        return toResponse(loadOwned(id));
    }

    public InstanceResponse rename(Long id, RenameInstanceRequest request) {
        Instance instance = loadOwned(id);
        CallerIdentity caller = instanceSecurity.currentCaller();
        String newName = request.getName();
        if (newName.equals(instance.getName())) {
            return toResponse(instance);
        }
        if (instanceRepository.existsByNameAndStatusNotAndIdNot(newName, InstanceStatus.DELETED, id)) {
            throw new AppException(ErrorCode.INSTANCE_NAME_TAKEN);
        }
        if (instanceRepository.rename(id, newName, InstanceStatus.DELETED) == 0) {
            throw new AppException(ErrorCode.INSTANCE_NOT_FOUND);
        }
        moveDnsRecord(instance, newName);

        eventRecorder.record(EventType.INSTANCE_RENAMED, caller, id,
                Map.of("newName", newName, "previousName", instance.getName()));
        return toResponse(reload(id));
    }

    public void delete(Long id) {
        Instance instance = loadOwned(id);
        CallerIdentity caller = instanceSecurity.currentCaller();
        instanceTeardownService.teardown(instance, caller.actorType(), caller.getName());
    }

    public void restart(Long id) {
        Instance instance = loadOwned(id);
        CallerIdentity caller = instanceSecurity.currentCaller();
        if (!vmGateway.isConfigured()) {
            throw new AppException(ErrorCode.UPSTREAM_NOT_CONFIGURED, "VM provider");
        }
        try {
            vmGateway.rebootServer(instance.getId());
        } catch (Exception e) {
            log.error("Failed to restart server {}: {}", id, e.getMessage());
            throw new AppException(ErrorCode.UPSTREAM_FAILED, e);
        }
        eventRecorder.record(EventType.INSTANCE_RESTARTED, caller, id, Map.of());
    }

    public InstanceResponse extend(Long id) {
        Instance instance = loadOwned(id);
        CallerIdentity caller = instanceSecurity.currentCaller();

        Instant next = instance.getExpiresAt().plus(extensionDays, ChronoUnit.DAYS);
        Instant limit = instance.getCreatedAt().plus(maxLifetimeDays, ChronoUnit.DAYS);
        if (next.isAfter(limit)) {
            throw new AppException(ErrorCode.EXTENSION_LIMIT_EXCEEDED);
        }
        if (instanceRepository.extendExpiry(id, instance.getExpiresAt(), next) == 0) {
            throw new AppException(ErrorCode.INVALID_STATE, "expiry changed concurrently");
        }

        eventRecorder.record(EventType.INSTANCE_EXTENDED, caller, id, Map.of("newExpiresAt", next.toString()));
        return toResponse(reload(id));
    }

    public InstanceAccessResponse access(Long id) {
        Instance instance = loadOwned(id);
        String host = hostnameResolver.hostnameOf(instance.getName());

        InstanceAccessResponse response = instanceMapper.toInstanceAccessResponse(instance);
        response.setHostname(host);
        response.setSsh("ssh root@" + instance.getIp());
        if (instance.getGatewayToken() != null) {
            response.setChatUrl("https://" + host + "/chat#token=" + instance.getGatewayToken());
        }
        if (instance.getTerminalToken() != null) {
            response.setTerminalUrl("https://" + host + "/terminal/" + instance.getTerminalToken() + "/");
        }
        return response;
    }

    public InstanceHealthResponse health(Long id) {
        Instance instance = loadOwned(id);

        String vmStatus = "unknown";
        try {
            vmStatus = vmGateway.getServerStatus(instance.getId()).orElse("unknown");
        } catch (Exception e) {
            log.debug("Status probe for server {} failed: {}", id, e.getMessage());
        }

        return InstanceHealthResponse.builder()
                .healthy("running".equals(vmStatus) && instance.getStatus() == InstanceStatus.RUNNING)
                .vmStatus(vmStatus)
                .instanceStatus(instance.getStatus())
                .callbackReceived(instance.getVmWallet() != null)
                .build();
    }

    public void retryMint(Long id) {
        loadOwned(id);
        mintAndFinalizeService.retry(id, instanceSecurity.currentCaller());
    }

    public InstanceResponse updateAgent(Long id, UpdateAgentRequest request) {
        Instance instance = loadOwned(id);
        mintAndFinalizeService.updateAgent(instance, request, instanceSecurity.currentCaller());
        return toResponse(instance);
    }

    public InstanceResponse updateTelegram(Long id, UpdateTelegramRequest request) {
        Instance instance = requireRunning(loadOwned(id));
        CallerIdentity caller = instanceSecurity.currentCaller();
        String botToken = request.getTelegramBotToken().trim();

        String username = channelGateway.resolveBotUsername(botToken);
        channelGateway.clearSubscription(botToken);
        sessionBridgeService.pushChannelConfig(instance.getIp(), botToken);

        if (instanceRepository.updateChannel(id, credentialCrypto.encrypt(botToken), username, InstanceStatus.RUNNING) == 0) {
            throw new AppException(ErrorCode.INVALID_STATE);
        }
        eventRecorder.record(EventType.INSTANCE_CHANNEL_UPDATED, caller, id, Map.of("botUsername", username));
        return toResponse(reload(id));
    }

    public WithdrawResponse withdraw(Long id, WithdrawRequest request) {
        Instance instance = requireRunning(loadOwned(id));
        CallerIdentity caller = instanceSecurity.currentCaller();

        String output = sessionBridgeService.withdraw(instance.getIp(), request.getAsset(), request.getAmount(), request.getTo());

        eventRecorder.record(EventType.INSTANCE_WITHDRAWAL, caller, id, Map.of(
                "asset", request.getAsset().symbol(),
                "amount", request.getAmount(),
                "to", request.getTo()));
        log.info("Withdrew {} {} from instance {} to {}", request.getAmount(), request.getAsset().symbol(), id, request.getTo());
        return WithdrawResponse.builder()
                .asset(request.getAsset())
                .amount(request.getAmount())
                .to(request.getTo())
                .output(output)
                .build();
    }

    public SyncResponse sync() {
        CallerIdentity caller = instanceSecurity.currentCaller();
        SyncResponse response = reconciliationService.sync(caller);
        response.setInstances(list(false));
        return response;
    }

    private Instance loadOwned(Long id) {
        Instance instance = instanceRepository.findByIdAndStatusNot(id, InstanceStatus.DELETED)
                .orElseThrow(() -> new AppException(ErrorCode.INSTANCE_NOT_FOUND));
        instanceSecurity.requireOwner(instance);
        return instance;
    }

    private Instance reload(Long id) {
        return instanceRepository.findById(id).orElseThrow(() -> new AppException(ErrorCode.INSTANCE_NOT_FOUND));
    }

    private static Instance requireRunning(Instance instance) {
        if (instance.getStatus() != InstanceStatus.RUNNING) {
            throw new AppException(ErrorCode.INVALID_STATE, "instance is " + instance.getStatus().value());
        }
        return instance;
    }

    private void moveDnsRecord(Instance instance, String newName) {
        if (!dnsGateway.isConfigured()) return;
        try {
            dnsGateway.deleteRecord(hostnameResolver.hostnameOf(instance.getName()));
            dnsGateway.createRecord(hostnameResolver.hostnameOf(newName), instance.getIp());
        } catch (Exception e) {
            log.warn("DNS move for instance {} to {} failed: {}", instance.getId(), newName, e.getMessage());
        }
    }

    private InstanceResponse toResponse(Instance instance) {
        InstanceResponse response = instanceMapper.toInstanceResponse(instance);
        response.setHostname(hostnameResolver.hostnameOf(instance.getName()));
        return response;
    }
}
