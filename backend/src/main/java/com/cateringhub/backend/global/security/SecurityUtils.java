package com.cateringhub.backend.global.security;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

/**
 * Reads the CateringHub user behind the current request. Controllers pass the id on as the
 * actor of every membership and invitation operation.
 */
public final class SecurityUtils {

    static final String AUTHENTICATION_REQUIRED = "AUTHENTICATION_REQUIRED";

    private SecurityUtils() {
    }

    /**
     * @throws ResponseStatusException 401 when the request carries no verified access token
     */
    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return principal;
        }
        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, AUTHENTICATION_REQUIRED);
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
