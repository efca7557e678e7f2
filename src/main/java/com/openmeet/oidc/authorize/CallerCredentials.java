package com.openmeet.oidc.authorize;

/**
 * How the caller of /authorize proves who they are: the session cookie, or a
 * bootstrap token for API callers. The bootstrap token wins when both are present.
 */
public final class CallerCredentials {

    private final String sessionId;
    private final String bootstrapToken;

    private CallerCredentials(String sessionId, String bootstrapToken) {
        this.sessionId = sessionId;
        this.bootstrapToken = bootstrapToken;
    }

    public static CallerCredentials of(String sessionId, String bootstrapToken) {
        return new CallerCredentials(blankToNull(sessionId), blankToNull(bootstrapToken));
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getBootstrapToken() {
        return bootstrapToken;
    }

    public boolean usesBootstrapToken() {
        return bootstrapToken != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
