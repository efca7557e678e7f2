package com.openmeet.oidc.error;

import java.time.Duration;

/**
 * Terminal failure of a single OIDC request.
 * Nothing is retried internally; the handler turns this into the HTTP response.
 */
public class OidcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OidcErrorKind kind;
    private final String errorCode;
    private final Duration retryAfter;

    public OidcException(OidcErrorKind kind, String message) {
        this(kind, kind.getDefaultErrorCode(), message, null);
    }

    public OidcException(OidcErrorKind kind, String errorCode, String message) {
        this(kind, errorCode, message, null);
    }

    private OidcException(OidcErrorKind kind, String errorCode, String message, Duration retryAfter) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public static OidcException malformed(String message) {
        return new OidcException(OidcErrorKind.MALFORMED_REQUEST, message);
    }

    public static OidcException unknownClient(String message) {
        return new OidcException(OidcErrorKind.UNKNOWN_OR_MISMATCHED_CLIENT, message);
    }

    public static OidcException invalidSession(String message) {
        return new OidcException(OidcErrorKind.INVALID_SESSION, message);
    }

    public static OidcException invalidCode(String message) {
        return new OidcException(OidcErrorKind.INVALID_OR_EXPIRED_CODE, message);
    }

    public static OidcException clientAuthFailure(String message) {
        return new OidcException(OidcErrorKind.CLIENT_AUTH_FAILURE, message);
    }

    public static OidcException invalidToken(String message) {
        return new OidcException(OidcErrorKind.INVALID_TOKEN, message);
    }

    public static OidcException rateLimited(Duration retryAfter) {
        return new OidcException(OidcErrorKind.RATE_LIMITED, OidcErrorKind.RATE_LIMITED.getDefaultErrorCode(),
            "Too many requests", retryAfter);
    }

    public OidcErrorKind getKind() {
        return kind;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Only set for {@link OidcErrorKind#RATE_LIMITED}.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
