package com.agentbox.backend.service;

import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.dto.request.AuthRequest;
import com.agentbox.backend.dto.response.AuthenticationResponse;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.utils.Base58;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuthenticationServiceTest {
    private static final String OPERATOR = "operator-secret";
    private static final String TREASURY = "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin";

    @Mock
    EventRecorder eventRecorder;

    AuthenticationService service;

    @BeforeEach
    void setUp() {
        service = new AuthenticationService(eventRecorder);
        ReflectionTestUtils.setField(service, "SIGNER_KEY", "0123456789abcdef0123456789abcdef0123456789abcdef");
        ReflectionTestUtils.setField(service, "VALID_DURATION", 86400L);
        ReflectionTestUtils.setField(service, "OPERATOR_TOKEN", OPERATOR);
        ReflectionTestUtils.setField(service, "TREASURY_WALLET", TREASURY);
    }

    @Test
    void operatorSecretResolvesToOperator() {
        Optional<CallerIdentity> caller = service.resolve(OPERATOR);

        assertThat(caller).isPresent();
        assertThat(caller.get().isOperator()).isTrue();
        assertThat(caller.get().isAdmin()).isTrue();
    }

    @Test
    void issuedTokenResolvesToItsWallet() {
        String wallet = "4Nd1mYQzvgV8Vr3Z3nYb7ngN1F1dC8Q7Hk3bP2mTQx9d";

        Optional<CallerIdentity> caller = service.resolve(service.generateToken(wallet));

        assertThat(caller).contains(CallerIdentity.wallet(wallet, false));
    }

    @Test
    void treasuryWalletIsAdmin() {
        assertThat(service.resolve(service.generateToken(TREASURY)))
                .hasValueSatisfying(c -> assertThat(c.isAdmin()).isTrue());
    }

    @Test
    void expiredOrForeignTokensAreRejected() {
        ReflectionTestUtils.setField(service, "VALID_DURATION", -10L);
        String expired = service.generateToken("wallet");
        ReflectionTestUtils.setField(service, "VALID_DURATION", 86400L);

        String valid = service.generateToken("wallet");
        ReflectionTestUtils.setField(service, "SIGNER_KEY", "another-signer-key-another-signer-key-0000");

        assertThat(service.resolve(expired)).isEmpty();
        assertThat(service.resolve(valid)).isEmpty();
        assertThat(service.resolve("not-a-jwt")).isEmpty();
        assertThat(service.resolve("")).isEmpty();
    }

    @Test
    void signInWithValidWalletSignatureIssuesToken() throws Exception {
        KeyPair keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        byte[] encoded = keyPair.getPublic().getEncoded();
        // X.509 wraps the raw 32-byte key after a 12-byte prefix
        String wallet = Base58.encode(Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length));
        long timestamp = System.currentTimeMillis();

        Signature signer = Signature.getInstance("Ed25519");
        signer.initSign(keyPair.getPrivate());
        signer.update(("Sign in to AgentBox\nTimestamp: " + timestamp).getBytes(StandardCharsets.UTF_8));
        String signature = Base64.getEncoder().encodeToString(signer.sign());

        AuthenticationResponse response = service.signIn(new AuthRequest(wallet, signature, timestamp));

        assertThat(response.isAdmin()).isFalse();
        assertThat(service.resolve(response.getToken())).contains(CallerIdentity.wallet(wallet, false));
        verify(eventRecorder).record(eq(EventType.AUTH_SIGNED_IN), eq("wallet"), eq(wallet), isNull(), anyMap());
    }

    @Test
    void signInRejectsWrongSignature() throws Exception {
        KeyPair keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        byte[] encoded = keyPair.getPublic().getEncoded();
        String wallet = Base58.encode(Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length));
        long timestamp = System.currentTimeMillis();

        Signature signer = Signature.getInstance("Ed25519");
        signer.initSign(keyPair.getPrivate());
        signer.update(("Sign in to AgentBox\nTimestamp: " + (timestamp - 1)).getBytes(StandardCharsets.UTF_8));
        String signature = Base64.getEncoder().encodeToString(signer.sign());

        assertThatThrownBy(() -> service.signIn(new AuthRequest(wallet, signature, timestamp)))
                .isInstanceOf(AppException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_SIGNATURE);
    }

    @Test
    void signInRejectsStaleTimestamp() {
        long stale = System.currentTimeMillis() - 6 * 60 * 1000L;

        assertThatThrownBy(() -> service.signIn(new AuthRequest(TREASURY, "AAAA", stale)))
                .isInstanceOf(AppException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TIMESTAMP_EXPIRED);
    }
}
