package com.openmeet.oidc.client;

import java.util.Optional;

/**
 * Per-tenant catalog of registered OAuth2 clients.
 */
public interface ClientRegistry {

    /**
     * Find a client registered for the given tenant. A client id registered
     * under another tenant is not found.
     */
    Optional<OAuthClient> lookup(String tenantId, String clientId);

    /**
     * Exact string match against the client's allowlist. No prefix, wildcard
     * or normalisation is applied.
     */
    default boolean validateRedirectUri(OAuthClient client, String redirectUri) {
        return client != null && redirectUri != null && client.getRedirectUris().contains(redirectUri);
    }
}
