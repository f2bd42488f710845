package com.agentbox.backend.dto.response;

import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import java.time.Instant;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class InstanceResponse {
    Long id;
    String name;
    String hostname;
    String ownerWallet;
    InstanceStatus status;
    ProvisioningStep provisioningStep;
    String ip;
    String vmWallet;
    String nftMint;
    String telegramBotUsername;
    String snapshotId;
    String location;
    Instant createdAt;
    Instant expiresAt;
}
