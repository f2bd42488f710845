package com.agentbox.backend.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CallbackRequest {
    @NotNull(message = "INVALID_SERVER_ID")
    Long serverId;

    @NotBlank
    String secret;

    @JsonAlias("solanaWalletAddress")
    String vmWallet;
    String gatewayToken;
}
