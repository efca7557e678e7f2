package com.openmeet.oidc.code;

/**
 * Raised by {@link AuthCodeCodec#verify(String)}.
 */
public class AuthCodeVerificationException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** Bad signature, foreign issuer, wrong token type or missing claims. */
        INVALID,
        /** Well-formed and correctly signed but past its expiry. */
        EXPIRED
    }

    private final Reason reason;

    public AuthCodeVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthCodeVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
