package com.cateringhub.backend.global.security;

import java.io.IOException;

import com.cateringhub.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes the 401 problem body. A request without a bearer token gets {@code AUTHENTICATION_REQUIRED};
 * one whose token failed verification in {@link JwtAuthenticationFilter} gets {@code INVALID_ACCESS_TOKEN}.
 * The underlying exception message is never echoed to the client.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String INVALID_ACCESS_TOKEN = "INVALID_ACCESS_TOKEN";

    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean badToken = authException instanceof BadCredentialsException;
        ProblemResponse body;
        if (badToken) {
            log.debug("Rejected access token on {} {}", request.getMethod(), request.getRequestURI());
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, INVALID_ACCESS_TOKEN,
                    "The access token is invalid or has expired", request.getRequestURI());
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        } else {
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, SecurityUtils.AUTHENTICATION_REQUIRED,
                    "Sign in to CateringHub to manage providers and invitations", request.getRequestURI());
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
