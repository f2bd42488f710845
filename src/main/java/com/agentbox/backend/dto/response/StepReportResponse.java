package com.agentbox.backend.dto.response;

import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class StepReportResponse {
    boolean ok;
    ProvisioningStep step;
}
