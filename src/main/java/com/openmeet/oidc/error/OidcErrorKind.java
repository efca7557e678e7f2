package com.openmeet.oidc.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the authorization server.
 * Each kind fixes the HTTP status and the default OAuth2 {@code error} code.
 */
public enum OidcErrorKind {

    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST, "invalid_request"),
    UNKNOWN_OR_MISMATCHED_CLIENT(HttpStatus.UNAUTHORIZED, "unauthorized_client"),
    INVALID_SESSION(HttpStatus.UNAUTHORIZED, "login_required"),
    INVALID_OR_EXPIRED_CODE(HttpStatus.UNAUTHORIZED, "invalid_grant"),
    CLIENT_AUTH_FAILURE(HttpStatus.UNAUTHORIZED, "invalid_client"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "invalid_token"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "slow_down");

    private final HttpStatus status;
    private final String defaultErrorCode;

    OidcErrorKind(HttpStatus status, String defaultErrorCode) {
        this.status = status;
        this.defaultErrorCode = defaultErrorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultErrorCode() {
        return defaultErrorCode;
    }
}
