package com.cateringhub.backend.modules.invitation.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Issues 256-bit bearer tokens and the digest under which they are stored.
 */
@Component
public class InvitationTokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    public InvitationTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public String hash(String rawToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
