package com.openmeet.oidc.client;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A registered OAuth2 client of one tenant.
 * Loaded once from configuration and immutable at request time.
 */
public final class OAuthClient {

    private final String clientId;
    private final String tenantId;
    private final String clientName;
    private final Set<String> redirectUris;
    private final boolean confidential;
    private final String secretHash;
    private final Set<String> scopes;

    public OAuthClient(String clientId, String tenantId, String clientName, Set<String> redirectUris,
                       boolean confidential, String secretHash, Set<String> scopes) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.clientName = clientName != null ? clientName : clientId;
        this.redirectUris = Collections.unmodifiableSet(new LinkedHashSet<>(redirectUris));
        this.confidential = confidential;
        this.secretHash = secretHash;
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    }

    public String getClientId() {
        return clientId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientName() {
        return clientName;
    }

    public Set<String> getRedirectUris() {
        return redirectUris;
    }

    public boolean isConfidential() {
        return confidential;
    }

    /**
     * PasswordEncoder hash of the client secret, or null for a public client without one.
     */
    public String getSecretHash() {
        return secretHash;
    }

    public Set<String> getScopes() {
        return scopes;
    }

    @Override
    public String toString() {
        return "OAuthClient{clientId=" + clientId + ", tenantId=" + tenantId
            + ", confidential=" + confidential + "}";
    }
}
