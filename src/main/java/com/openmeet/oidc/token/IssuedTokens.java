package com.openmeet.oidc.token;

/**
 * Result of a successful code exchange.
 */
public final class IssuedTokens {

    private final String accessToken;
    private final String idToken;
    private final long expiresIn;
    private final String scope;

    public IssuedTokens(String accessToken, String idToken, long expiresIn, String scope) {
        this.accessToken = accessToken;
        this.idToken = idToken;
        this.expiresIn = expiresIn;
        this.scope = scope;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getIdToken() {
        return idToken;
    }

    /**
     * Access token lifetime in seconds.
     */
    public long getExpiresIn() {
        return expiresIn;
    }

    public String getScope() {
        return scope;
    }
}
