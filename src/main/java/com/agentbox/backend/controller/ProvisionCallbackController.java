package com.agentbox.backend.controller;

import com.agentbox.backend.common.LogApi;
import com.agentbox.backend.dto.ApiResponse;
import com.agentbox.backend.dto.request.CallbackRequest;
import com.agentbox.backend.dto.request.StepReportRequest;
import com.agentbox.backend.dto.response.BootConfigResponse;
import com.agentbox.backend.dto.response.StepReportResponse;
import com.agentbox.backend.service.ProvisionCallbackService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.web.bind.annotation.*;

/** Endpoints called by the VM itself; authenticated by the callback token only. */
@RestController
@RequestMapping("/instances")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ProvisionCallbackController {
    ProvisionCallbackService provisionCallbackService;

    @LogApi
    @PostMapping("/callback/step")
    ApiResponse<StepReportResponse> reportStep(@RequestBody @Valid StepReportRequest request) {
        return ApiResponse.<StepReportResponse>builder()
                .result(provisionCallbackService.reportStep(request))
                .build();
    }

    @LogApi
    @PostMapping("/callback")
    ApiResponse<String> callback(@RequestBody @Valid CallbackRequest request) {
        provisionCallbackService.finalize(request);
        return ApiResponse.<String>builder().result("ok").build();
    }

    @LogApi
    @GetMapping("/config")
    ApiResponse<BootConfigResponse> bootConfig(@RequestParam(value = "serverId", required = false) Long serverId,
                                               @RequestParam(value = "secret", required = false) String secret,
                                               @RequestHeader(value = "X-Callback-Token", required = false) String headerToken) {
        return ApiResponse.<BootConfigResponse>builder()
                .result(provisionCallbackService.bootConfig(serverId, secret != null ? secret : headerToken))
                .build();
    }
}
