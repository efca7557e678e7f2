package com.openmeet.oidc.replay;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * ReplayGuard backed by Redis SET NX PX, so consumption is atomic across pods.
 */
public class RedisReplayGuard implements ReplayGuard {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;
    private final Duration ttl;

    public RedisReplayGuard(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix + "used_auth_code:";
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public boolean tryConsume(String tenantId, String codeId) {
        Boolean inserted = redisTemplate.opsForValue()
            .setIfAbsent(key(tenantId, codeId), Long.toString(clock.millis()), ttl);
        return Boolean.TRUE.equals(inserted);
    }

    @Override
    public boolean isConsumed(String tenantId, String codeId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(tenantId, codeId)));
    }

    private String key(String tenantId, String codeId) {
        return keyPrefix + tenantId + ':' + codeId;
    }
}
