package com.agentbox.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class StepReportRequest {
    @NotNull(message = "INVALID_SERVER_ID")
    Long serverId;

    @NotBlank
    String secret;

    @NotBlank(message = "UNKNOWN_PROVISIONING_STEP")
    String step;
}
