package com.agentbox.backend.entity;

import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.io.Serializable;
import java.time.Instant;

/**
 * One provisioned machine. The primary key is the server id assigned by the VM provider.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "instances", indexes = {
        @Index(name = "instances_owner_wallet_idx", columnList = "owner_wallet"),
        @Index(name = "instances_nft_mint_idx", columnList = "nft_mint"),
        @Index(name = "instances_expires_at_idx", columnList = "expires_at")
})
public class Instance extends AbstractAuditingEntity<Long> implements Serializable {
    @Id
    Long id;

    @Column(nullable = false, length = 63)
    String name;

    @Column(name = "owner_wallet", nullable = false, length = 64)
    String ownerWallet;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    InstanceStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    ProvisioningStep provisioningStep;

    @Column(nullable = false, length = 64)
    String ip;

    String gatewayToken;
    String terminalToken;
    String callbackToken;

    @Column(length = 64)
    String vmWallet;

    @Column(name = "nft_mint", length = 64)
    String nftMint;

    String telegramBotToken;        // iv:tag:ciphertext
    String telegramBotUsername;

    String rootPassword;            // iv:tag:ciphertext

    String snapshotId;
    String location;

    @Column(nullable = false)
    Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    Instant expiresAt;

    Instant deletedAt;
}
