package com.agentbox.backend.dto.response;

import com.agentbox.backend.entity.enumeration.InstanceStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class InstanceHealthResponse {
    boolean healthy;
    String vmStatus;
    InstanceStatus instanceStatus;
    boolean callbackReceived;
}
