package com.agentbox.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class UpdateTelegramRequest {
    @NotBlank(message = "INVALID_CHANNEL_TOKEN")
    String telegramBotToken;
}
