package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.dto.response.SyncResponse;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.repository.InstanceRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Brings stored ownership in line with the chain. The chain is authoritative: a token held
 * by the wallet claims its instance, and a token whose row lost track of it is re-linked
 * through the server id embedded in its metadata.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ReconciliationService {
    static final Pattern SERVER_ID = Pattern.compile("^\\d{1,18}$");

    InstanceRepository instanceRepository;
    LedgerGateway ledgerGateway;
    EventRecorder eventRecorder;

    /** Counts only; the caller's refreshed listing is attached by the caller of this method. */
    public SyncResponse sync(CallerIdentity caller) {
        String wallet = caller.getWallet();
        if (wallet == null) {
            // the operator owns no tokens
            return SyncResponse.builder().claimed(0).recovered(0).build();
        }
        if (!ledgerGateway.isConfigured()) {
            throw new AppException(ErrorCode.UPSTREAM_NOT_CONFIGURED, "ledger");
        }

        List<String> owned;
        try {
            owned = ledgerGateway.ownedTokensOf(wallet);
        } catch (RuntimeException e) {
            log.warn("Token lookup for {} failed: {}", wallet, e.getMessage());
            throw new AppException(ErrorCode.UPSTREAM_FAILED, e);
        }

        int claimed = 0;
        int recovered = 0;
        Set<String> matched = new HashSet<>();

        if (!owned.isEmpty()) {
            for (Instance instance : instanceRepository.findAllByNftMintInAndStatusNot(owned, InstanceStatus.DELETED)) {
                matched.add(instance.getNftMint());
                if (wallet.equals(instance.getOwnerWallet())) continue;
                if (instanceRepository.updateOwner(instance.getId(), wallet) == 1) {
                    claimed++;
                    eventRecorder.record(EventType.INSTANCE_CLAIMED, caller, instance.getId(),
                            Map.of("previousOwner", instance.getOwnerWallet()));
                    log.info("Instance {} claimed by {} (was {})", instance.getId(), wallet, instance.getOwnerWallet());
                }
            }
        }

        for (String mint : owned) {
            if (matched.contains(mint)) continue;
            Optional<Long> serverId = embeddedServerId(mint);
            if (serverId.isEmpty()) continue;
            if (instanceRepository.recoverIdentity(serverId.get(), mint, wallet, InstanceStatus.DELETED) == 1) {
                recovered++;
                eventRecorder.record(EventType.INSTANCE_RECOVERED, caller, serverId.get(), Map.of("mint", mint));
                log.info("Instance {} re-linked to identity {} owned by {}", serverId.get(), mint, wallet);
            }
        }

        eventRecorder.record(EventType.SYNC_REQUESTED, caller, null,
                Map.of("claimed", claimed, "recovered", recovered));
        return SyncResponse.builder().claimed(claimed).recovered(recovered).build();
    }

    private Optional<Long> embeddedServerId(String mint) {
        try {
            return ledgerGateway.loadIdentity(mint)
                    .map(d -> d.getAdditionalMetadata().get(Constants.LEDGER.SERVER_ID_METADATA_KEY))
                    .filter(v -> SERVER_ID.matcher(v).matches())
                    .map(Long::valueOf);
        } catch (RuntimeException e) {
            log.debug("Skipping mint {}: {}", mint, e.getMessage());
            return Optional.empty();
        }
    }
}
