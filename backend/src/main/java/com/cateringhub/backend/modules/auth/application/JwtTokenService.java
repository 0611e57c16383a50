package com.cateringhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.cateringhub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 access tokens. The subject is the user id and the
 * {@code email} claim carries the account email used for invitation matching.
 */
@Service
public class JwtTokenService {

    private static final String EMAIL_CLAIM = "email";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public String issueAccessToken(UUID userId, String email) {
        Instant now = clock.instant();
        Instant accessExpiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(accessExpiry))
                .claim(EMAIL_CLAIM, email)
                .signWith(key, SIG.HS256)
                .compact();
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(EMAIL_CLAIM, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    email,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String email, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
