package com.agentbox.backend.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * AES-256-GCM for secrets at rest. Ciphertext format is {@code iv:tag:ciphertext}, all hex.
 */
@Slf4j
@Component
public class CredentialCrypto {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 12;
    private static final int TAG_BYTES = 16;
    private static final int KEY_BYTES = 32;
    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})*$");
    private static final HexFormat hex = HexFormat.of();

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public CredentialCrypto(@Value("${agentbox.encryption-key}") String keyHex) {
        if (keyHex == null || keyHex.length() != KEY_BYTES * 2 || !HEX.matcher(keyHex).matches()) {
            throw new IllegalStateException("agentbox.encryption-key must be " + (KEY_BYTES * 2) + " hex characters");
        }
        this.key = new SecretKeySpec(hex.parseHex(keyHex), "AES");
    }

    public String encrypt(String plaintext) {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            // JCE appends the tag to the ciphertext
            byte[] body = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_BYTES, sealed.length);
            return hex.formatHex(iv) + ":" + hex.formatHex(tag) + ":" + hex.formatHex(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    public String decrypt(String ciphertext) {
        if (ciphertext == null) throw new IllegalArgumentException("Malformed ciphertext");
        String[] parts = ciphertext.split(":", -1);
        if (parts.length != 3) throw new IllegalArgumentException("Malformed ciphertext");
        for (String part : parts) {
            if (!HEX.matcher(part).matches()) throw new IllegalArgumentException("Malformed ciphertext");
        }
        byte[] iv = hex.parseHex(parts[0]);
        byte[] tag = hex.parseHex(parts[1]);
        byte[] body = hex.parseHex(parts[2]);
        if (iv.length != IV_BYTES || tag.length != TAG_BYTES) {
            throw new IllegalArgumentException("Malformed ciphertext");
        }

        byte[] sealed = new byte[body.length + tag.length];
        System.arraycopy(body, 0, sealed, 0, body.length);
        System.arraycopy(tag, 0, sealed, body.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new IllegalStateException("Ciphertext failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Decryption failed", e);
        }
    }
}
