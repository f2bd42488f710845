package com.agentbox.backend.controller;

import com.agentbox.backend.common.LogApi;
import com.agentbox.backend.dto.ApiResponse;
import com.agentbox.backend.dto.request.AuthRequest;
import com.agentbox.backend.dto.response.AuthenticationResponse;
import com.agentbox.backend.service.AuthenticationService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/instances")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AuthenticationController {
    AuthenticationService authenticationService;

    @LogApi
    @PostMapping("/auth")
    ApiResponse<AuthenticationResponse> signIn(@RequestBody @Valid AuthRequest request) {
        return ApiResponse.<AuthenticationResponse>builder()
                .result(authenticationService.signIn(request))
                .build();
    }
}
