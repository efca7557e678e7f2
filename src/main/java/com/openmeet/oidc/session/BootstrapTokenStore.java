package com.openmeet.oidc.session;

import java.util.Optional;

/**
 * Single-use bootstrap tokens that let an already-authenticated API caller
 * enter /authorize without the interactive login redirect.
 */
public interface BootstrapTokenStore {

    /**
     * Mint a token bound to (tenantId, userId).
     */
    String issue(String tenantId, String userId);

    /**
     * Atomically redeem the token. A second call with the same token, a call
     * for another tenant, or a call after expiry returns empty.
     *
     * @return the user id the token was issued for
     */
    Optional<String> consume(String tenantId, String token);
}
