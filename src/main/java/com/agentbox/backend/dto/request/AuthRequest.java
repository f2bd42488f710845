package com.agentbox.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AuthRequest {
    @NotBlank(message = "INVALID_WALLET_ADDRESS")
    @Pattern(regexp = "^[1-9A-HJ-NP-Za-km-z]{32,44}$", message = "INVALID_WALLET_ADDRESS")
    String walletAddress;

    @NotBlank(message = "INVALID_SIGNATURE")
    String signature;       // base64

    @NotNull(message = "TIMESTAMP_EXPIRED")
    Long timestamp;         // epoch millis
}
