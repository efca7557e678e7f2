package com.openmeet.oidc.authorize;

/**
 * Parameters of a GET /authorize call, as received.
 */
public final class AuthorizationRequest {

    private final String tenantId;
    private final String clientId;
    private final String redirectUri;
    private final String responseType;
    private final String scope;
    private final String state;
    private final String nonce;

    public AuthorizationRequest(String tenantId, String clientId, String redirectUri, String responseType,
                                String scope, String state, String nonce) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.redirectUri = redirectUri;
        this.responseType = responseType;
        this.scope = scope;
        this.state = state;
        this.nonce = nonce;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getResponseType() {
        return responseType;
    }

    public String getScope() {
        return scope;
    }

    public String getState() {
        return state;
    }

    public String getNonce() {
        return nonce;
    }
}
