package com.openmeet.oidc.ratelimit;

public class DisabledRateLimiter implements RateLimiter {

    @Override
    public RateLimitResult hit(String key) {
        return RateLimitResult.unlimited();
    }
}
