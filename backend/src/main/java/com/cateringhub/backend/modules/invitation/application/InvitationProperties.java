package com.cateringhub.backend.modules.invitation.application;

import java.time.Duration;

import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param ttl           lifetime of a freshly issued or reissued invitation
 * @param acceptUrlBase page that receives the {@code token} query parameter
 * @param fromAddress   sender of invitation mail
 * @param retryBackoff  pause before retrying the creation transaction after a lock failure
 */
@Validated
@ConfigurationProperties(prefix = "cateringhub.invitations")
public record InvitationProperties(
        Duration ttl,
        @NotBlank String acceptUrlBase,
        @NotBlank String fromAddress,
        Duration retryBackoff
) {

    public InvitationProperties {
        if (ttl == null) {
            ttl = Duration.ofHours(48);
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("cateringhub.invitations.ttl must be positive");
        }
        if (retryBackoff == null) {
            retryBackoff = Duration.ofMillis(100);
        }
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("cateringhub.invitations.retry-backoff must not be negative");
        }
    }
}
