package com.openmeet.oidc.user;

import java.util.Optional;

/**
 * User lookup capability of the platform. The authorization server only reads
 * through it, always with an explicit tenant.
 */
public interface UserDirectory {

    Optional<UserClaims> findById(String tenantId, String userId);

    /**
     * Verify an email/password pair within one tenant.
     *
     * @return the user on success, empty for an unknown email or a wrong password
     */
    Optional<UserClaims> authenticate(String tenantId, String email, String password);
}
