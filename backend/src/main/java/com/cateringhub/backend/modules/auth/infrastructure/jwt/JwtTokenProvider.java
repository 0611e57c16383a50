package com.cateringhub.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HS256 key that CateringHub access tokens are signed and verified with.
 * <p>
 * {@code jwt.secret} may be Base64 or plain text; anything that does not decode as Base64 is
 * taken as UTF-8 bytes. Keys shorter than 256 bits fail at startup instead of on the first request.
 */
@Component
public class JwtTokenProvider {

    static final int MIN_KEY_BYTES = 32;

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey signingKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        byte[] keyBytes = decode(secret);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must provide at least " + MIN_KEY_BYTES
                    + " bytes of key material, got " + keyBytes.length);
        }
        this.signingKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return signingKey;
    }

    private static byte[] decode(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException notBase64) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }
}
