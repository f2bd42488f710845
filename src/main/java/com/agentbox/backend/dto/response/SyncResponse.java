package com.agentbox.backend.dto.response;

import java.util.List;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SyncResponse {
    int claimed;
    int recovered;
    List<InstanceResponse> instances;
}
