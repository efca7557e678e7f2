package com.openmeet.oidc.ratelimit;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * RateLimiter shared by all pods: one INCR per request on a key scoped to the
 * current window; the first hit sets the key's expiry.
 */
public class RedisRateLimiter implements RateLimiter {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;
    private final FixedWindow window;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock,
                            int maxRequests, Duration window) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix + "ratelimit:";
        this.clock = clock;
        this.window = new FixedWindow(maxRequests, window);
    }

    @Override
    public RateLimitResult hit(String key) {
        Instant now = clock.instant();
        long index = window.index(now);
        String redisKey = keyPrefix + key + ':' + index;
        Long count = redisTemplate.opsForValue().increment(redisKey);
        if (count == null) {
            throw new IllegalStateException("INCR returned no value for " + redisKey);
        }
        if (count == 1L) {
            redisTemplate.expire(redisKey, window.length());
        }
        return window.evaluate(count, index, now);
    }
}
