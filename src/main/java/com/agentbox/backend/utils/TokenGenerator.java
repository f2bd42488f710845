package com.agentbox.backend.utils;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

@Component
public class TokenGenerator {
    private static final String NAME_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom rnd = new SecureRandom();

    /** 256-bit hex secret. */
    public String secret() {
        byte[] bytes = new byte[32];
        rnd.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public String instanceName() {
        StringBuilder sb = new StringBuilder("agent-");
        for (int i = 0; i < 8; i++) {
            sb.append(NAME_ALPHABET.charAt(rnd.nextInt(NAME_ALPHABET.length())));
        }
        return sb.toString();
    }
}
