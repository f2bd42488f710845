package com.agentbox.backend.service;

import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.dto.request.AuthRequest;
import com.agentbox.backend.dto.response.AuthenticationResponse;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.utils.Base58;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;
import java.text.ParseException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns bearer credentials into a {@link CallerIdentity}: the operator secret, or an
 * HS256 token issued here after a wallet signs the sign-in message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AuthenticationService {
    static final String SIGN_IN_MESSAGE = "Sign in to AgentBox\nTimestamp: ";
    static final long MAX_PAST_SKEW_MS = 5 * 60 * 1000L;
    static final long MAX_FUTURE_SKEW_MS = 60 * 1000L;

    EventRecorder eventRecorder;

    @NonFinal
    @Value("${jwt.signer-key:}")
    protected String SIGNER_KEY;

    @NonFinal
    @Value("${jwt.valid-duration:86400}")
    protected long VALID_DURATION;

    @NonFinal
    @Value("${agentbox.operator-token:}")
    protected String OPERATOR_TOKEN;

    @NonFinal
    @Value("${agentbox.treasury-wallet:}")
    protected String TREASURY_WALLET;

    public AuthenticationResponse signIn(AuthRequest request) {
        long age = System.currentTimeMillis() - request.getTimestamp();
        if (age > MAX_PAST_SKEW_MS || age < -MAX_FUTURE_SKEW_MS) {
            throw new AppException(ErrorCode.TIMESTAMP_EXPIRED);
        }

        byte[] publicKey;
        byte[] signature;
        try {
            publicKey = Base58.decode(request.getWalletAddress());
            signature = Base64.getDecoder().decode(request.getSignature());
        } catch (IllegalArgumentException e) {
            throw new AppException(ErrorCode.INVALID_SIGNATURE);
        }

        byte[] message = (SIGN_IN_MESSAGE + request.getTimestamp()).getBytes(StandardCharsets.UTF_8);
        if (!verifyEd25519(publicKey, message, signature)) {
            throw new AppException(ErrorCode.INVALID_SIGNATURE);
        }

        String wallet = request.getWalletAddress();
        String token = generateToken(wallet);
        eventRecorder.record(EventType.AUTH_SIGNED_IN, "wallet", wallet, null, Map.of());
        log.info("Wallet {} signed in", wallet);

        return AuthenticationResponse.builder()
                .token(token)
                .admin(isTreasury(wallet))
                .build();
    }

    /** Empty when the credential is neither the operator secret nor a valid, unexpired token. */
    public Optional<CallerIdentity> resolve(String bearer) {
        if (bearer == null || bearer.isBlank()) return Optional.empty();

        if (OPERATOR_TOKEN != null && !OPERATOR_TOKEN.isBlank()
                && MessageDigest.isEqual(OPERATOR_TOKEN.getBytes(StandardCharsets.UTF_8), bearer.getBytes(StandardCharsets.UTF_8))) {
            return Optional.of(CallerIdentity.operator());
        }

        try {
            SignedJWT signedJWT = verifyToken(bearer);
            String wallet = signedJWT.getJWTClaimsSet().getSubject();
            return Optional.of(CallerIdentity.wallet(wallet, isTreasury(wallet)));
        } catch (AppException | ParseException | JOSEException e) {
            log.debug("Bearer token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isTreasury(String wallet) {
        return TREASURY_WALLET != null && !TREASURY_WALLET.isBlank() && TREASURY_WALLET.equals(wallet);
    }

    String generateToken(String wallet) {
        JWSHeader header = new JWSHeader(JWSAlgorithm.HS256);

        JWTClaimsSet jwtClaimsSet = new JWTClaimsSet.Builder()
                .subject(wallet)
                .issuer("agentbox")
                .issueTime(new Date())
                .expirationTime(new Date(
                        Instant.now().plus(VALID_DURATION, ChronoUnit.SECONDS).toEpochMilli()))
                .jwtID(UUID.randomUUID().toString())
                .build();

        JWSObject jwsObject = new JWSObject(header, new Payload(jwtClaimsSet.toJSONObject()));

        try {
            jwsObject.sign(new MACSigner(SIGNER_KEY.getBytes(StandardCharsets.UTF_8)));
            return jwsObject.serialize();
        } catch (JOSEException e) {
            log.error("Cannot create token", e);
            throw new AppException(ErrorCode.UNCATEGORIZED_EXCEPTION, e);
        }
    }

    private SignedJWT verifyToken(String token) throws JOSEException, ParseException {
        JWSVerifier verifier = new MACVerifier(SIGNER_KEY.getBytes(StandardCharsets.UTF_8));

        SignedJWT signedJWT = SignedJWT.parse(token);
        if (!JWSAlgorithm.HS256.equals(signedJWT.getHeader().getAlgorithm())) {
            throw new AppException(ErrorCode.UNAUTHENTICATED);
        }

        Date expiryTime = signedJWT.getJWTClaimsSet().getExpirationTime();
        var verified = signedJWT.verify(verifier);

        if (!(verified && expiryTime != null && expiryTime.after(new Date()))) {
            throw new AppException(ErrorCode.UNAUTHENTICATED);
        }
        String subject = signedJWT.getJWTClaimsSet().getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AppException(ErrorCode.UNAUTHENTICATED);
        }
        return signedJWT;
    }

    /** Raw 32-byte Ed25519 key: little-endian y, sign of x in the top bit. */
    private boolean verifyEd25519(byte[] publicKey, byte[] message, byte[] signature) {
        if (publicKey.length != 32 || signature.length != 64) return false;
        try {
            byte[] bigEndian = new byte[32];
            for (int i = 0; i < 32; i++) bigEndian[i] = publicKey[31 - i];
            boolean xOdd = (bigEndian[0] & 0x80) != 0;
            bigEndian[0] &= 0x7F;

            EdECPoint point = new EdECPoint(xOdd, new BigInteger(1, bigEndian));
            PublicKey key = KeyFactory.getInstance("Ed25519")
                    .generatePublic(new EdECPublicKeySpec(NamedParameterSpec.ED25519, point));

            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(key);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            log.debug("Ed25519 verification error: {}", e.getMessage());
            return false;
        }
    }
}
