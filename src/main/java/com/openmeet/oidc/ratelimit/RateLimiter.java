package com.openmeet.oidc.ratelimit;

/**
 * Fixed-window request counter.
 */
public interface RateLimiter {

    /**
     * Count one request against the key and report whether it is within the limit.
     */
    RateLimitResult hit(String key);
}
