package com.agentbox.backend.dto.request;

import com.agentbox.backend.entity.enumeration.Asset;
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
public class WithdrawRequest {
    @NotNull(message = "INVALID_WITHDRAWAL")
    Asset asset;

    @NotBlank(message = "INVALID_WITHDRAWAL")
    @Pattern(regexp = "^(?:\\d{1,12})(?:\\.\\d{1,9})?$", message = "INVALID_WITHDRAWAL")
    String amount;

    @NotBlank(message = "INVALID_WITHDRAWAL")
    @Pattern(regexp = "^[1-9A-HJ-NP-Za-km-z]{32,44}$", message = "INVALID_WITHDRAWAL")
    String to;
}
