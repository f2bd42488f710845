package com.agentbox.backend.dto.request;

import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class UpdateAgentRequest {
    @Size(min = 1, max = 32)
    String name;

    @Size(max = 500)
    String description;
}
