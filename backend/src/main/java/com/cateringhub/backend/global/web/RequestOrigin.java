package com.cateringhub.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;

/**
 * Network origin and client descriptor of the request that triggered a privileged action.
 * Both values are optional and only ever written to the audit trail.
 */
public record RequestOrigin(String ipAddress, String userAgent) {

    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static final RequestOrigin UNKNOWN = new RequestOrigin(null, null);

    public static RequestOrigin from(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        return new RequestOrigin(resolveIp(request), truncate(request.getHeader("User-Agent")));
    }

    private static String resolveIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            // first hop is the original client
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }

    private static String truncate(String userAgent) {
        if (!StringUtils.hasText(userAgent)) {
            return null;
        }
        return userAgent.length() > USER_AGENT_MAX_LENGTH ? userAgent.substring(0, USER_AGENT_MAX_LENGTH) : userAgent;
    }
}
