package com.openmeet.oidc.session;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Bootstrap tokens in Redis. Redemption is GETDEL, so two pods racing on the
 * same token cannot both succeed.
 */
public class RedisBootstrapTokenStore implements BootstrapTokenStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisBootstrapTokenStore(StringRedisTemplate redisTemplate, String keyPrefix, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix + "bootstrap:";
        this.ttl = ttl;
    }

    @Override
    public String issue(String tenantId, String userId) {
        String token = SecureTokens.generate();
        redisTemplate.opsForValue().set(key(tenantId, token), userId, ttl);
        return token;
    }

    @Override
    public Optional<String> consume(String tenantId, String token) {
        if (tenantId == null || !SecureTokens.isWellFormed(token)) {
            return Optional.empty();
        }
        return Optional.ofNullable(redisTemplate.opsForValue().getAndDelete(key(tenantId, token)));
    }

    private String key(String tenantId, String token) {
        return keyPrefix + tenantId + ':' + token;
    }
}
