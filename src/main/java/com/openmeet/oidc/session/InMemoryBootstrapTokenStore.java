package com.openmeet.oidc.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBootstrapTokenStore implements BootstrapTokenStore {

    private final Map<String, Entry> tokens = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryBootstrapTokenStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public String issue(String tenantId, String userId) {
        Instant now = clock.instant();
        tokens.values().removeIf(e -> !now.isBefore(e.expiresAt));
        String token = SecureTokens.generate();
        tokens.put(key(tenantId, token), new Entry(userId, now.plus(ttl)));
        return token;
    }

    @Override
    public Optional<String> consume(String tenantId, String token) {
        if (tenantId == null || !SecureTokens.isWellFormed(token)) {
            return Optional.empty();
        }
        // remove() is the atomic redemption
        Entry entry = tokens.remove(key(tenantId, token));
        if (entry == null || !clock.instant().isBefore(entry.expiresAt)) {
            return Optional.empty();
        }
        return Optional.of(entry.userId);
    }

    private static String key(String tenantId, String token) {
        return tenantId + ':' + token;
    }

    private static final class Entry {
        final String userId;
        final Instant expiresAt;

        Entry(String userId, Instant expiresAt) {
            this.userId = userId;
            this.expiresAt = expiresAt;
        }
    }
}
