package com.cateringhub.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 body returned by every failing CateringHub endpoint. {@code code} is the stable
 * machine-readable identifier (for example {@code INVITATION_EXPIRED}); {@code type} is derived from it.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_PREFIX = "https://cateringhub.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String resolvedDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(typeFor(resolvedCode), httpStatus.getReasonPhrase(), httpStatus.value(),
                resolvedDetail, instance, resolvedCode);
    }

    public static ProblemResponse from(ProblemException ex, String instance) {
        return of(ex.getKind().status(), ex.getCode(), ex.getDetailMessage(), instance);
    }

    static String typeFor(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replace('_', '-').replaceAll("[^a-z0-9\\-.]+", "-");
    }
}
