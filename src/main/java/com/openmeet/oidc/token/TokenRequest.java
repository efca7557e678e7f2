package com.openmeet.oidc.token;

/**
 * Parameters of a POST /token call. Client credentials arrive either in the
 * form (client_secret_post) or in the Basic header (client_secret_basic); the
 * controller merges both into this object. A Basic header that cannot be
 * decoded is carried as a flag and rejected after the rate limit.
 */
public final class TokenRequest {

    private final String grantType;
    private final String code;
    private final String redirectUri;
    private final String clientId;
    private final String clientSecret;
    private final String callerAddress;
    private final boolean malformedClientCredentials;

    public TokenRequest(String grantType, String code, String redirectUri, String clientId,
                        String clientSecret, String callerAddress) {
        this(grantType, code, redirectUri, clientId, clientSecret, callerAddress, false);
    }

    public TokenRequest(String grantType, String code, String redirectUri, String clientId,
                        String clientSecret, String callerAddress, boolean malformedClientCredentials) {
        this.grantType = grantType;
        this.code = code;
        this.redirectUri = redirectUri;
        this.clientId = blankToNull(clientId);
        this.clientSecret = blankToNull(clientSecret);
        this.callerAddress = callerAddress;
        this.malformedClientCredentials = malformedClientCredentials;
    }

    public String getGrantType() {
        return grantType;
    }

    public String getCode() {
        return code;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getCallerAddress() {
        return callerAddress;
    }

    public boolean hasMalformedClientCredentials() {
        return malformedClientCredentials;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
