package com.openmeet.oidc.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process SessionStore. Used with oidc.store.type=memory.
 */
public class InMemorySessionStore implements SessionStore {

    private static final int SWEEP_INTERVAL = 1024;

    private final Map<String, LoginSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong creations = new AtomicLong();
    private final Clock clock;
    private final Duration ttl;

    public InMemorySessionStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public LoginSession create(String tenantId, String userId) {
        Instant now = clock.instant();
        LoginSession session = new LoginSession(SecureTokens.generate(), tenantId, userId, now, now.plus(ttl));
        sessions.put(key(tenantId, session.getId()), session);
        if (creations.incrementAndGet() % SWEEP_INTERVAL == 0) {
            sessions.values().removeIf(s -> s.isExpired(now));
        }
        return session;
    }

    @Override
    public Optional<LoginSession> get(String tenantId, String sessionId) {
        if (tenantId == null || !SecureTokens.isWellFormed(sessionId)) {
            return Optional.empty();
        }
        String key = key(tenantId, sessionId);
        LoginSession session = sessions.get(key);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpired(clock.instant())) {
            sessions.remove(key, session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    public void delete(String tenantId, String sessionId) {
        if (tenantId != null && sessionId != null) {
            sessions.remove(key(tenantId, sessionId));
        }
    }

    private static String key(String tenantId, String sessionId) {
        return tenantId + ':' + sessionId;
    }
}
