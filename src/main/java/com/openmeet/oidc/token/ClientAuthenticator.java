package com.openmeet.oidc.token;

import com.openmeet.oidc.client.OAuthClient;
import com.openmeet.oidc.error.OidcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Client authentication at the token endpoint.
 *
 * Confidential clients must present a secret matching the registered hash.
 * Public clients need none, but a secret they do send is checked when one is
 * registered. Missing and wrong secrets produce the same response; only the
 * log tells them apart.
 */
public class ClientAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(ClientAuthenticator.class);

    static final String FAILURE_MESSAGE = "Invalid client credentials: client_secret missing or incorrect";

    private final PasswordEncoder passwordEncoder;

    public ClientAuthenticator(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public void authenticate(OAuthClient client, String clientSecret) {
        if (client.isConfidential()) {
            if (clientSecret == null) {
                log.warn("Client {} (tenant {}) did not send its required client_secret",
                    client.getClientId(), client.getTenantId());
                throw OidcException.clientAuthFailure(FAILURE_MESSAGE);
            }
            if (!secretMatches(client, clientSecret)) {
                log.warn("Invalid client_secret for client {} (tenant {})", client.getClientId(), client.getTenantId());
                throw OidcException.clientAuthFailure(FAILURE_MESSAGE);
            }
            return;
        }
        if (clientSecret != null && client.getSecretHash() != null && !secretMatches(client, clientSecret)) {
            log.warn("Invalid client_secret for public client {} (tenant {})", client.getClientId(), client.getTenantId());
            throw OidcException.clientAuthFailure(FAILURE_MESSAGE);
        }
    }

    private boolean secretMatches(OAuthClient client, String clientSecret) {
        if (client.getSecretHash() == null) {
            return false;
        }
        try {
            return passwordEncoder.matches(clientSecret, client.getSecretHash());
        } catch (IllegalArgumentException e) {
            // hash without a {id} prefix the DelegatingPasswordEncoder knows
            log.error("Unusable secret hash configured for client {} (tenant {}): {}",
                client.getClientId(), client.getTenantId(), e.getMessage());
            return false;
        }
    }
}
