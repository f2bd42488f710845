package com.agentbox.backend.webClient;

import com.agentbox.backend.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Custodial signer: holds the hot wallet key, submits transfers and identity
 * registrations and waits for confirmation.
 */
@Component
public class LedgerSignerApiStrategy extends AbstractApiStrategy {
    private final String signerUrl;
    private final String signerToken;

    public LedgerSignerApiStrategy(WebClient.Builder builder,
                                   @Value("${ledger.signer-url:}") String signerUrl,
                                   @Value("${ledger.signer-token:}") String signerToken) {
        super(builder, Constants.LEDGER.NAME_SERVICE, signerUrl, Duration.ofMinutes(2));
        this.signerUrl = signerUrl;
        this.signerToken = signerToken;
    }

    @Override
    public boolean isConfigured() {
        return signerUrl != null && !signerUrl.isBlank() && signerToken != null && !signerToken.isBlank();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(signerToken);
    }
}
