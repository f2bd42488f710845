package com.agentbox.backend.dto.response;

import com.agentbox.backend.entity.enumeration.InstanceStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class InstanceAccessResponse {
    Long id;
    String name;
    String hostname;
    String ip;
    InstanceStatus status;
    String gatewayToken;
    String terminalToken;
    String ssh;
    String chatUrl;
    String terminalUrl;
}
