package com.agentbox.backend.webClient;

import com.agentbox.backend.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/** JSON-RPC endpoint for read-only chain queries. */
@Component
public class SolanaRpcApiStrategy extends AbstractApiStrategy {
    private final String rpcUrl;

    public SolanaRpcApiStrategy(WebClient.Builder builder,
                                @Value("${ledger.rpc-url:}") String rpcUrl) {
        super(builder, Constants.LEDGER.RPC_SERVICE, rpcUrl, Duration.ofSeconds(30));
        this.rpcUrl = rpcUrl;
    }

    @Override
    public boolean isConfigured() {
        return rpcUrl != null && !rpcUrl.isBlank();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        // public RPC, no auth
    }
}
