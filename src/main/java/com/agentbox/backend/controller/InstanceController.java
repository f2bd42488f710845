package com.agentbox.backend.controller;

import com.agentbox.backend.common.LogApi;
import com.agentbox.backend.dto.ApiResponse;
import com.agentbox.backend.dto.request.CreateInstanceRequest;
import com.agentbox.backend.dto.request.RenameInstanceRequest;
import com.agentbox.backend.dto.request.UpdateAgentRequest;
import com.agentbox.backend.dto.request.UpdateTelegramRequest;
import com.agentbox.backend.dto.request.WithdrawRequest;
import com.agentbox.backend.dto.response.InstanceAccessResponse;
import com.agentbox.backend.dto.response.InstanceHealthResponse;
import com.agentbox.backend.dto.response.InstanceResponse;
import com.agentbox.backend.dto.response.SyncResponse;
import com.agentbox.backend.dto.response.WithdrawResponse;
import com.agentbox.backend.service.InstanceService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/instances")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class InstanceController {
    InstanceService instanceService;

    @LogApi
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    ApiResponse<InstanceResponse> create(@RequestBody(required = false) @Valid CreateInstanceRequest request) {
        return ApiResponse.<InstanceResponse>builder()
                .result(instanceService.create(request == null ? new CreateInstanceRequest() : request))
                .build();
    }

    @LogApi
    @GetMapping
    ApiResponse<List<InstanceResponse>> list(@RequestParam(defaultValue = "false") boolean all) {
        return ApiResponse.<List<InstanceResponse>>builder()
                .result(instanceService.list(all))
                .build();
    }

    @LogApi
    @GetMapping("/expiring")
    ApiResponse<List<InstanceResponse>> expiring(@RequestParam(defaultValue = "3") int days,
                                                 @RequestParam(defaultValue = "false") boolean all) {
        return ApiResponse.<List<InstanceResponse>>builder()
                .result(instanceService.expiring(days, all))
                .build();
    }

    @LogApi
    @PostMapping("/sync")
    ApiResponse<SyncResponse> sync() {
        return ApiResponse.<SyncResponse>builder()
                .result(instanceService.sync())
                .build();
    }

    @LogApi
    @GetMapping("/{id}")
    ApiResponse<InstanceResponse> get(@PathVariable("id") Long id) {
        return ApiResponse.<InstanceResponse>builder()
                .result(instanceService.get(id))
                .build();
    }

    @LogApi
    @PatchMapping("/{id}")
    ApiResponse<InstanceResponse> rename(@PathVariable("id") Long id, @RequestBody @Valid RenameInstanceRequest request) {
        return ApiResponse.<InstanceResponse>builder()
                .result(instanceService.rename(id, request))
                .build();
    }

    @LogApi
    @PatchMapping("/{id}/agent")
    ApiResponse<InstanceResponse> updateAgent(@PathVariable("id") Long id, @RequestBody @Valid UpdateAgentRequest request) {
        return ApiResponse.<InstanceResponse>builder()
                .result(instanceService.updateAgent(id, request))
                .build();
    }

    @LogApi
    @DeleteMapping("/{id}")
    ApiResponse<String> delete(@PathVariable("id") Long id) {
        instanceService.delete(id);
        return ApiResponse.<String>builder().result("Instance has been deleted").build();
    }

    @LogApi
    @PostMapping("/{id}/mint")
    ApiResponse<String> retryMint(@PathVariable("id") Long id) {
        instanceService.retryMint(id);
        return ApiResponse.<String>builder().result("Mint retry queued").build();
    }

    @LogApi
    @PostMapping("/{id}/restart")
    ApiResponse<String> restart(@PathVariable("id") Long id) {
        instanceService.restart(id);
        return ApiResponse.<String>builder().result("Restart requested").build();
    }

    @LogApi
    @PostMapping("/{id}/extend")
    ApiResponse<InstanceResponse> extend(@PathVariable("id") Long id) {
        return ApiResponse.<InstanceResponse>builder()
                .result(instanceService.extend(id))
                .build();
    }

    @LogApi
    @GetMapping("/{id}/access")
    ApiResponse<InstanceAccessResponse> access(@PathVariable("id") Long id) {
        return ApiResponse.<InstanceAccessResponse>builder()
                .result(instanceService.access(id))
                .build();
    }

    @LogApi
    @GetMapping("/{id}/health")
    ApiResponse<InstanceHealthResponse> health(@PathVariable("id") Long id) {
        return ApiResponse.<InstanceHealthResponse>builder()
                .result(instanceService.health(id))
                .build();
    }

    @LogApi
    @PutMapping("/{id}/telegram")
    ApiResponse<InstanceResponse> updateTelegram(@PathVariable("id") Long id,
                                                 @RequestBody @Valid UpdateTelegramRequest request) {
        return ApiResponse.<InstanceResponse>builder()
                .result(instanceService.updateTelegram(id, request))
                .build();
    }

    @LogApi
    @PostMapping("/{id}/withdraw")
    ApiResponse<WithdrawResponse> withdraw(@PathVariable("id") Long id, @RequestBody @Valid WithdrawRequest request) {
        return ApiResponse.<WithdrawResponse>builder()
                .result(instanceService.withdraw(id, request))
                .build();
    }
}
