package com.openmeet.oidc.session;

import java.util.Optional;

/**
 * Per-tenant login sessions, addressed by (tenantId, sessionId).
 *
 * Implementations look the id up as an exact key; a session is only ever
 * visible under the tenant it was created for.
 */
public interface SessionStore {

    LoginSession create(String tenantId, String userId);

    /**
     * @return the session, or empty when the id is malformed, unknown, expired
     *         or belongs to another tenant
     */
    Optional<LoginSession> get(String tenantId, String sessionId);

    void delete(String tenantId, String sessionId);
}
