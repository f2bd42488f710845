package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.dto.request.CallbackRequest;
import com.agentbox.backend.dto.request.StepReportRequest;
import com.agentbox.backend.dto.response.BootConfigResponse;
import com.agentbox.backend.dto.response.StepReportResponse;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.MintJob;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.MintJobStatus;
import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.repository.InstanceRepository;
import com.agentbox.backend.repository.MintJobRepository;
import com.agentbox.backend.utils.CredentialCrypto;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;

/**
 * Phone-home endpoints of a booting VM. Trust comes from the per-instance callback token
 * alone; every guard is a single conditional update and a miss is reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ProvisionCallbackService {
    InstanceRepository instanceRepository;
    MintJobRepository mintJobRepository;
    EventRecorder eventRecorder;
    CredentialCrypto credentialCrypto;
    ApplicationEventPublisher eventPublisher;

    @NonFinal
    @Value("${llm.provider-url:https://sol.blockrun.ai}")
    String llmProviderUrl;

    @NonFinal
    @Value("${llm.provider-name:blockrun}")
    String llmProviderName;

    @NonFinal
    @Value("${llm.default-model:nvidia/gpt-oss-120b}")
    String llmDefaultModel;

    public StepReportResponse reportStep(StepReportRequest request) {
        ProvisioningStep step = ProvisioningStep.fromValue(request.getStep())
                .orElseThrow(() -> new AppException(ErrorCode.UNKNOWN_PROVISIONING_STEP));

        int updated = instanceRepository.updateProvisioningStep(request.getServerId(), request.getSecret(),
                step, step.notAfter(), InstanceStatus.PROVISIONING);
        if (updated == 0) {
            throw new AppException(ErrorCode.INSTANCE_NOT_FOUND);
        }

        eventRecorder.record(EventType.INSTANCE_STEP_REPORTED, Constants.ACTOR.VM,
                String.valueOf(request.getServerId()), request.getServerId(), Map.of("step", step.value()));
        log.debug("Instance {} reported step {}", request.getServerId(), step.value());
        return StepReportResponse.builder().ok(true).step(step).build();
    }

    /**
     * Consumes the callback token and queues the funding/minting job in the same transaction.
     * A replayed token matches nothing and yields 404.
     */
    @Transactional
    public void finalize(CallbackRequest request) {
        Long id = request.getServerId();
        String vmWallet = blankToNull(request.getVmWallet());

        int updated = instanceRepository.completeProvisioning(id, request.getSecret(), vmWallet,
                blankToNull(request.getGatewayToken()), InstanceStatus.PROVISIONING, InstanceStatus.MINTING);
        if (updated == 0) {
            throw new AppException(ErrorCode.INSTANCE_NOT_FOUND);
        }

        MintJob job = mintJobRepository.save(MintJob.builder()
                .instanceId(id)
                .status(MintJobStatus.PENDING)
                .createdAt(Instant.now())
                .build());

        eventRecorder.record(EventType.INSTANCE_CALLBACK_RECEIVED, Constants.ACTOR.VM, String.valueOf(id), id,
                Map.of("vmWallet", vmWallet == null ? "" : vmWallet));
        log.info("Instance {} called back, wallet {}, mint job {} queued", id, vmWallet, job.getId());

        eventPublisher.publishEvent(new MintJobQueuedEvent(id, job.getId()));
    }

    public BootConfigResponse bootConfig(Long serverId, String secret) {
        if (serverId == null || secret == null || secret.isBlank()) {
            throw new AppException(ErrorCode.INSTANCE_NOT_FOUND);
        }
        Instance instance = instanceRepository
                .findByIdAndStatusAndCallbackToken(serverId, InstanceStatus.PROVISIONING, secret)
                .orElseThrow(() -> new AppException(ErrorCode.INSTANCE_NOT_FOUND));

        return BootConfigResponse.builder()
                .llmProviderUrl(llmProviderUrl)
                .llmProviderName(llmProviderName)
                .llmDefaultModel(llmDefaultModel)
                .telegramBotToken(instance.getTelegramBotToken() == null
                        ? null : credentialCrypto.decrypt(instance.getTelegramBotToken()))
                .build();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
