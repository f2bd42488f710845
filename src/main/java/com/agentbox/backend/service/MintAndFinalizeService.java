package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.dto.request.UpdateAgentRequest;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.MintJob;
import com.agentbox.backend.entity.enumeration.Asset;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.MintJobStatus;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.repository.InstanceRepository;
import com.agentbox.backend.repository.MintJobRepository;
import com.agentbox.backend.utils.HostnameResolver;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Funds the VM wallet, mints its identity token and hands the token to the owner.
 * Every step is recorded on the job so a resumed job skips what already happened, and
 * the instance always ends up running whatever the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class MintAndFinalizeService {
    InstanceRepository instanceRepository;
    MintJobRepository mintJobRepository;
    LedgerGateway ledgerGateway;
    EventRecorder eventRecorder;
    HostnameResolver hostnameResolver;
    ApplicationEventPublisher eventPublisher;

    @Qualifier("taskExecutor")
    Executor taskExecutor;

    @NonFinal
    @Value("${ledger.funding.native-amount:1000000}")
    long nativeAmount;

    @NonFinal
    @Value("${ledger.funding.stable-amount:1000000}")
    long stableAmount;

    @NonFinal
    @Value("${agentbox.identity-image:https://agentbox.fyi/logo.png}")
    String identityImage;

    /** Runs one claimed job to completion. Never throws for ledger failures. */
    public void process(MintJob job) {
        Long id = job.getInstanceId();
        Optional<Instance> found = instanceRepository.findById(id);
        if (found.isEmpty() || found.get().getStatus() != InstanceStatus.MINTING) {
            log.info("Mint job {} skipped: instance {} is {}", job.getId(), id,
                    found.map(i -> i.getStatus().value()).orElse("gone"));
            complete(job, MintJobStatus.DONE);
            return;
        }
        Instance instance = found.get();

        if (instance.getVmWallet() == null) {
            log.warn("Instance {} reached minting without a VM wallet, skipping funding and mint", id);
        } else if (!ledgerGateway.isConfigured()) {
            log.warn("Ledger signer not configured, instance {} goes live without funding or identity", id);
            eventRecorder.recordSystem(EventType.INSTANCE_MINT_FAILED, Constants.ACTOR.WORKER, id,
                    Map.of("error", "ledger signer not configured"));
        } else {
            fund(job, instance);
            String mint = mint(job, instance);
            if (mint != null) {
                transferToOwner(job, instance, mint);
            }
        }

        markRunning(id);
        complete(job, MintJobStatus.DONE);
    }

    /** Forces a job that keeps failing out of the queue without stranding its instance. */
    public void abandon(MintJob job, String reason) {
        log.error("Mint job {} for instance {} abandoned after {} attempts: {}",
                job.getId(), job.getInstanceId(), job.getAttempts(), reason);
        job.setLastError(reason);
        eventRecorder.recordSystem(EventType.INSTANCE_MINT_FAILED, Constants.ACTOR.WORKER, job.getInstanceId(),
                Map.of("error", reason));
        markRunning(job.getInstanceId());
        complete(job, MintJobStatus.FAILED);
    }

    /**
     * Manual retry. The status flip to minting is the only gate, so two concurrent
     * requests cannot both start a mint. When the token exists but never reached the
     * owner, only the transfer is retried.
     */
    @Transactional
    public void retry(Long id, CallerIdentity caller) {
        Instance instance = instanceRepository.findByIdAndStatusNot(id, InstanceStatus.DELETED)
                .orElseThrow(() -> new AppException(ErrorCode.INSTANCE_NOT_FOUND));

        MintJob.MintJobBuilder next = MintJob.builder()
                .instanceId(id)
                .status(MintJobStatus.PENDING)
                .createdAt(Instant.now());

        int updated;
        boolean transferOnly = instance.getNftMint() != null;
        if (transferOnly) {
            Optional<MintJob> untransferred = mintJobRepository
                    .findFirstByInstanceIdAndMintAddressOrderByIdDesc(id, instance.getNftMint())
                    .filter(j -> !j.isTransferred());
            if (untransferred.isEmpty()) {
                throw new AppException(ErrorCode.NFT_ALREADY_MINTED);
            }
            updated = instanceRepository.beginTransferRetry(id, instance.getNftMint(),
                    InstanceStatus.MINTING, InstanceStatus.MINT_RETRYABLE);
            next.nativeFunded(true).stableFunded(true).mintAddress(instance.getNftMint());
        } else {
            updated = instanceRepository.beginMintRetry(id, InstanceStatus.MINTING, InstanceStatus.MINT_RETRYABLE);
            mintJobRepository.findFirstByInstanceIdOrderByIdDesc(id).ifPresent(previous -> next
                    .nativeFunded(previous.isNativeFunded())
                    .stableFunded(previous.isStableFunded()));
        }

        if (updated == 0) {
            throw rejectRetry(id, transferOnly);
        }

        MintJob job = mintJobRepository.save(next.build());
        eventRecorder.record(EventType.INSTANCE_MINT_RETRIED, caller, id, Map.of());
        log.info("Mint retry for instance {} queued as job {}", id, job.getId());
        eventPublisher.publishEvent(new MintJobQueuedEvent(id, job.getId()));
    }

    /** Sets a stuck instance running without touching the ledger. */
    public boolean forceRunning(Long id) {
        return markRunning(id);
    }

    public void updateAgent(Instance instance, UpdateAgentRequest request, CallerIdentity caller) {
        if (instance.getNftMint() == null) {
            throw new AppException(ErrorCode.NFT_NOT_MINTED);
        }
        if (!ledgerGateway.isConfigured()) {
            throw new AppException(ErrorCode.UPSTREAM_NOT_CONFIGURED, "ledger signer");
        }
        String name = request.getName() == null || request.getName().isBlank() ? null : request.getName().trim();

        try {
            String uri = null;
            if (request.getDescription() != null) {
                uri = ledgerGateway.uploadDescriptor(descriptor(instance,
                        name == null ? instance.getName() : name, request.getDescription()));
            }
            ledgerGateway.updateIdentity(instance.getNftMint(), name, uri);
        } catch (RuntimeException e) {
            log.error("Identity update for instance {} failed: {}", instance.getId(), e.getMessage());
            throw new AppException(ErrorCode.UPSTREAM_FAILED, e);
        }

        eventRecorder.record(EventType.INSTANCE_AGENT_UPDATED, caller, instance.getId(), Map.of());
    }

    private void fund(MintJob job, Instance instance) {
        CompletableFuture<Boolean> nativeTransfer = job.isNativeFunded()
                ? CompletableFuture.completedFuture(true)
                : CompletableFuture.supplyAsync(() -> fundAsset(instance, Asset.SOL, nativeAmount), taskExecutor);
        CompletableFuture<Boolean> stableTransfer = job.isStableFunded()
                ? CompletableFuture.completedFuture(true)
                : CompletableFuture.supplyAsync(() -> fundAsset(instance, Asset.USDC, stableAmount), taskExecutor);

        job.setNativeFunded(nativeTransfer.join());
        job.setStableFunded(stableTransfer.join());
        mintJobRepository.save(job);
    }

    private boolean fundAsset(Instance instance, Asset asset, long amount) {
        try {
            ledgerGateway.transfer(asset, amount, instance.getVmWallet());
            eventRecorder.recordSystem(EventType.INSTANCE_FUNDED, Constants.ACTOR.WORKER, instance.getId(),
                    Map.of("asset", asset.symbol(), "amount", String.valueOf(amount)));
            return true;
        } catch (Exception e) {
            log.warn("Funding {} {} for instance {} failed: {}", amount, asset.symbol(), instance.getId(), e.getMessage());
            eventRecorder.recordSystem(EventType.INSTANCE_FUNDING_FAILED, Constants.ACTOR.WORKER, instance.getId(),
                    Map.of("asset", asset.symbol(), "error", String.valueOf(e.getMessage())));
            return false;
        }
    }

    private String mint(MintJob job, Instance instance) {
        if (job.getMintAddress() != null) {
            attach(instance.getId(), job.getMintAddress());
            return job.getMintAddress();
        }
        if (instance.getNftMint() != null) {
            job.setMintAddress(instance.getNftMint());
            mintJobRepository.save(job);
            return instance.getNftMint();
        }

        try {
            LedgerGateway.IdentityDescriptor descriptor = descriptor(instance, instance.getName(),
                    "AgentBox instance " + instance.getName());
            String uri = ledgerGateway.uploadDescriptor(descriptor);
            String mint = ledgerGateway.mintIdentity(descriptor, uri);

            job.setMintAddress(mint);
            mintJobRepository.save(job);
            attach(instance.getId(), mint);

            eventRecorder.recordSystem(EventType.INSTANCE_MINTED, Constants.ACTOR.WORKER, instance.getId(),
                    Map.of("mint", mint, "ownerWallet", instance.getOwnerWallet()));
            log.info("Identity {} minted for instance {}", mint, instance.getId());
            return mint;
        } catch (Exception e) {
            log.error("Minting identity for instance {} failed: {}", instance.getId(), e.getMessage());
            job.setLastError(e.getMessage());
            eventRecorder.recordSystem(EventType.INSTANCE_MINT_FAILED, Constants.ACTOR.WORKER, instance.getId(),
                    Map.of("error", String.valueOf(e.getMessage())));
            return null;
        }
    }

    private void transferToOwner(MintJob job, Instance instance, String mint) {
        if (job.isTransferred()) return;
        try {
            ledgerGateway.transferIdentity(mint, instance.getOwnerWallet());
            job.setTransferred(true);
            mintJobRepository.save(job);
            log.info("Identity {} transferred to {}", mint, instance.getOwnerWallet());
        } catch (Exception e) {
            log.warn("Identity {} stays in the custodial wallet, transfer to {} failed: {}. Retry via POST /instances/{}/mint",
                    mint, instance.getOwnerWallet(), e.getMessage(), instance.getId());
            job.setLastError(e.getMessage());
            eventRecorder.recordSystem(EventType.INSTANCE_NFT_TRANSFER_FAILED, Constants.ACTOR.WORKER, instance.getId(),
                    Map.of("mint", mint, "error", String.valueOf(e.getMessage())));
        }
    }

    private void attach(Long id, String mint) {
        if (instanceRepository.attachMint(id, mint) == 0) {
            log.debug("Instance {} already carries a mint, {} not attached", id, mint);
        }
    }

    private LedgerGateway.IdentityDescriptor descriptor(Instance instance, String name, String description) {
        return LedgerGateway.IdentityDescriptor.builder()
                .name(name)
                .description(description)
                .image(identityImage)
                .hostname(hostnameResolver.hostnameOf(instance.getName()))
                .agentWallet(instance.getVmWallet())
                .metadata(Constants.LEDGER.SERVER_ID_METADATA_KEY, String.valueOf(instance.getId()))
                .build();
    }

    private boolean markRunning(Long id) {
        if (instanceRepository.transitionStatus(id, InstanceStatus.MINTING, InstanceStatus.RUNNING) == 0) {
            return false;
        }
        eventRecorder.recordSystem(EventType.INSTANCE_RUNNING, Constants.ACTOR.WORKER, id, Map.of());
        log.info("Instance {} is running", id);
        return true;
    }

    private void complete(MintJob job, MintJobStatus status) {
        job.setStatus(status);
        job.setLeaseUntil(null);
        mintJobRepository.save(job);
    }

    private AppException rejectRetry(Long id, boolean transferOnly) {
        Instance current = instanceRepository.findByIdAndStatusNot(id, InstanceStatus.DELETED)
                .orElseThrow(() -> new AppException(ErrorCode.INSTANCE_NOT_FOUND));
        if (!transferOnly && current.getNftMint() != null) return new AppException(ErrorCode.NFT_ALREADY_MINTED);
        if (current.getVmWallet() == null) return new AppException(ErrorCode.VM_WALLET_MISSING);
        if (current.getStatus() == InstanceStatus.MINTING) return new AppException(ErrorCode.MINT_IN_PROGRESS);
        return new AppException(ErrorCode.INVALID_STATE);
    }
}
