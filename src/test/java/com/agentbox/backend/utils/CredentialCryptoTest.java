package com.agentbox.backend.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialCryptoTest {
    private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    private final CredentialCrypto crypto = new CredentialCrypto(KEY);

    @Test
    void decryptReturnsWhatWasEncrypted() {
        for (String plain : new String[]{"", "123456:ABC-DEF1234ghIkl-zyx57W2v1u123ew11", "ünïcødé ✓", "a:b:c"}) {
            assertThat(crypto.decrypt(crypto.encrypt(plain))).isEqualTo(plain);
        }
    }

    @Test
    void encryptUsesFreshNoncePerCall() {
        String a = crypto.encrypt("same");
        String b = crypto.encrypt("same");

        assertThat(a).isNotEqualTo(b);
        assertThat(a.split(":")).hasSize(3);
        assertThat(a.split(":")[0]).hasSize(24);
        assertThat(a.split(":")[1]).hasSize(32);
    }

    @Test
    void malformedCiphertextIsRejected() {
        assertThatThrownBy(() -> crypto.decrypt("abcd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.decrypt("aa:bb")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.decrypt("aa:bb:cc:dd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.decrypt("zz:bb:cc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.decrypt(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tamperedCiphertextFailsAuthentication() {
        String[] parts = crypto.encrypt("secret value").split(":");
        char first = parts[2].charAt(0);
        String flipped = (first == '0' ? '1' : '0') + parts[2].substring(1);

        assertThatThrownBy(() -> crypto.decrypt(parts[0] + ":" + parts[1] + ":" + flipped))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ciphertextFromAnotherKeyIsRejected() {
        CredentialCrypto other = new CredentialCrypto(KEY.replace('0', 'f'));

        assertThatThrownBy(() -> crypto.decrypt(other.encrypt("x"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void keyMustBe32BytesOfHex() {
        assertThatThrownBy(() -> new CredentialCrypto("abcd")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new CredentialCrypto(KEY.replace('a', 'g'))).isInstanceOf(IllegalStateException.class);
    }
}
