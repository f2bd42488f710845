package com.agentbox.backend.entity.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of audit event types. Each type declares the metadata keys it requires.
 */
public enum EventType {
    INSTANCE_CREATED("instance.created", "name", "ownerWallet", "ip", "expiresAt"),
    INSTANCE_CREATE_FAILED("instance.create_failed", "error"),
    INSTANCE_STEP_REPORTED("instance.step_reported", "step"),
    INSTANCE_CALLBACK_RECEIVED("instance.callback_received", "vmWallet"),
    INSTANCE_FUNDED("instance.funded", "asset", "amount"),
    INSTANCE_FUNDING_FAILED("instance.funding_failed", "asset", "error"),
    INSTANCE_MINTED("instance.minted", "mint", "ownerWallet"),
    INSTANCE_MINT_FAILED("instance.mint_failed", "error"),
    INSTANCE_NFT_TRANSFER_FAILED("instance.nft_transfer_failed", "mint", "error"),
    INSTANCE_RUNNING("instance.running"),
    INSTANCE_RENAMED("instance.renamed", "newName"),
    INSTANCE_AGENT_UPDATED("instance.agent_updated"),
    INSTANCE_DELETION_STARTED("instance.deletion_started"),
    INSTANCE_DELETED("instance.deleted"),
    INSTANCE_MINT_RETRIED("instance.mint_retried"),
    INSTANCE_RESTARTED("instance.restarted"),
    INSTANCE_EXTENDED("instance.extended", "newExpiresAt"),
    INSTANCE_EXPIRED("instance.expired"),
    INSTANCE_CLAIMED("instance.claimed", "previousOwner"),
    INSTANCE_RECOVERED("instance.recovered", "mint"),
    INSTANCE_CHANNEL_UPDATED("instance.channel_updated", "botUsername"),
    INSTANCE_WITHDRAWAL("instance.withdrawal", "asset", "amount", "to"),
    AUTH_SIGNED_IN("auth.signed_in"),
    SYNC_REQUESTED("sync.requested", "claimed", "recovered");

    private final String key;
    private final Set<String> requiredKeys;

    EventType(String key, String... requiredKeys) {
        this.key = key;
        this.requiredKeys = Set.of(requiredKeys);
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Set<String> requiredKeys() {
        return requiredKeys;
    }

    public boolean accepts(Map<String, ?> metadata) {
        return metadata != null && requiredKeys.stream().allMatch(k -> metadata.get(k) != null);
    }

    public static EventType fromKey(String key) {
        return Arrays.stream(values())
                .filter(t -> t.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + key));
    }
}
