package com.openmeet.oidc.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SessionStore kept in Redis so every pod sees the same sessions.
 *
 * Each session is a hash under {prefix}session:{tenantId}:{sessionId} whose
 * key expires together with the session. The hash and its expiry are written
 * in one MULTI/EXEC so a session key never exists without a TTL.
 */
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    private static final String USER_ID = "userId";
    private static final String CREATED_AT = "createdAt";
    private static final String EXPIRES_AT = "expiresAt";

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;
    private final Duration ttl;

    public RedisSessionStore(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix + "session:";
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public LoginSession create(String tenantId, String userId) {
        Instant now = clock.instant();
        LoginSession session = new LoginSession(SecureTokens.generate(), tenantId, userId, now, now.plus(ttl));
        String key = key(tenantId, session.getId());
        Map<String, String> fields = Map.of(
            USER_ID, userId,
            CREATED_AT, Long.toString(now.toEpochMilli()),
            EXPIRES_AT, Long.toString(session.getExpiresAt().toEpochMilli()));
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForHash().putAll(key, fields);
                ops.expire(key, ttl);
                return ops.exec();
            }
        });
        return session;
    }

    @Override
    public Optional<LoginSession> get(String tenantId, String sessionId) {
        if (tenantId == null || !SecureTokens.isWellFormed(sessionId)) {
            return Optional.empty();
        }
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(key(tenantId, sessionId));
        if (fields == null || !fields.containsKey(USER_ID)) {
            return Optional.empty();
        }
        try {
            LoginSession session = new LoginSession(
                sessionId,
                tenantId,
                (String) fields.get(USER_ID),
                Instant.ofEpochMilli(Long.parseLong((String) fields.get(CREATED_AT))),
                Instant.ofEpochMilli(Long.parseLong((String) fields.get(EXPIRES_AT))));
            return session.isExpired(clock.instant()) ? Optional.empty() : Optional.of(session);
        } catch (RuntimeException e) {
            log.warn("Unreadable session hash for tenant {}, treating session as invalid: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String tenantId, String sessionId) {
        if (tenantId != null && sessionId != null) {
            redisTemplate.delete(key(tenantId, sessionId));
        }
    }

    private String key(String tenantId, String sessionId) {
        return keyPrefix + tenantId + ':' + sessionId;
    }
}
