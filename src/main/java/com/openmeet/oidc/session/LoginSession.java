package com.openmeet.oidc.session;

import java.time.Instant;
import java.util.Objects;

/**
 * A login session created at successful login. Read-only once created.
 */
public final class LoginSession {

    private final String id;
    private final String tenantId;
    private final String userId;
    private final Instant createdAt;
    private final Instant expiresAt;

    public LoginSession(String id, String tenantId, String userId, Instant createdAt, Instant expiresAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    // id deliberately left out
    @Override
    public String toString() {
        return "LoginSession{tenantId=" + tenantId + ", userId=" + userId + ", expiresAt=" + expiresAt + "}";
    }
}
