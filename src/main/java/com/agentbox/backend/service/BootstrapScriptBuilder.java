package com.agentbox.backend.service;

import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * cloud-init user data. The only per-instance secrets written to the box are the
 * single-use callback token and the session tokens the box serves after boot; channel
 * credentials are fetched from the boot config endpoint while provisioning.
 */
@Component
public class BootstrapScriptBuilder {
    private static final Pattern SAFE_VALUE = Pattern.compile("^[A-Za-z0-9:/._\\-]+$");

    public String build(BootstrapParams params) {
        return String.join("\n", List.of(
                "#!/bin/bash",
                "set -euo pipefail",
                "",
                "mkdir -p /etc/agentbox",
                "SERVER_ID=$(curl -s http://169.254.169.254/hetzner/v1/metadata/instance-id)",
                "",
                "cat > /etc/agentbox/callback.env << 'ENVEOF'",
                "CALLBACK_URL=\"" + safe(params.getApiBaseUrl()) + "/instances/callback\"",
                "CONFIG_URL=\"" + safe(params.getApiBaseUrl()) + "/instances/config\"",
                "CALLBACK_SECRET=\"" + safe(params.getCallbackToken()) + "\"",
                "INSTANCE_HOSTNAME=\"" + safe(params.getHostname()) + "\"",
                "GATEWAY_TOKEN=\"" + safe(params.getGatewayToken()) + "\"",
                "TERMINAL_TOKEN=\"" + safe(params.getTerminalToken()) + "\"",
                "ENVEOF",
                "",
                "echo \"SERVER_ID=$SERVER_ID\" >> /etc/agentbox/callback.env",
                "chmod 600 /etc/agentbox/callback.env",
                "",
                "/usr/local/bin/agentbox-init.sh",
                ""));
    }

    private static String safe(String value) {
        if (value == null || !SAFE_VALUE.matcher(value).matches()) {
            throw new IllegalArgumentException("Unsafe value for bootstrap script: " + value);
        }
        return value;
    }

    @Value
    @Builder
    public static class BootstrapParams {
        String apiBaseUrl;
        String callbackToken;
        String hostname;
        String gatewayToken;
        String terminalToken;
    }
}
