package com.agentbox.backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BootConfigResponse {
    String llmProviderUrl;
    String llmProviderName;
    String llmDefaultModel;
    String telegramBotToken;
}
