package com.openmeet.oidc.code;

import java.time.Instant;
import java.util.Objects;

/**
 * State of one authorization code. Never stored: it travels inside the signed code itself.
 */
public final class AuthorizationCode {

    private final String codeId;
    private final String tenantId;
    private final String userId;
    private final String clientId;
    private final String redirectUri;
    private final String scope;
    private final String state;
    private final String nonce;
    private final Instant issuedAt;
    private final Instant expiresAt;

    public AuthorizationCode(String codeId, String tenantId, String userId, String clientId, String redirectUri,
                             String scope, String state, String nonce, Instant issuedAt, Instant expiresAt) {
        this.codeId = Objects.requireNonNull(codeId, "codeId");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.redirectUri = Objects.requireNonNull(redirectUri, "redirectUri");
        this.scope = scope;
        this.state = state;
        this.nonce = nonce;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public String getCodeId() {
        return codeId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getScope() {
        return scope;
    }

    /**
     * Null when the authorize request carried no state.
     */
    public String getState() {
        return state;
    }

    public String getNonce() {
        return nonce;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
