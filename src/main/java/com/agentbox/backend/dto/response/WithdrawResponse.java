package com.agentbox.backend.dto.response;

import com.agentbox.backend.entity.enumeration.Asset;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class WithdrawResponse {
    Asset asset;
    String amount;
    String to;
    String output;
}
