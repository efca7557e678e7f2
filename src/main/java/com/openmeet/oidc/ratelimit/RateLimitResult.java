package com.openmeet.oidc.ratelimit;

import java.time.Duration;

/**
 * Result of a rate limit check.
 */
public final class RateLimitResult {

    private static final RateLimitResult UNLIMITED = new RateLimitResult(true, -1, Duration.ZERO);

    private final boolean permitted;
    private final int remaining;
    private final Duration retryAfter;

    private RateLimitResult(boolean permitted, int remaining, Duration retryAfter) {
        this.permitted = permitted;
        this.remaining = remaining;
        this.retryAfter = retryAfter;
    }

    public static RateLimitResult unlimited() {
        return UNLIMITED;
    }

    public static RateLimitResult allow(int remaining) {
        return new RateLimitResult(true, remaining, Duration.ZERO);
    }

    public static RateLimitResult block(Duration retryAfter) {
        return new RateLimitResult(false, 0, retryAfter);
    }

    public boolean isPermitted() {
        return permitted;
    }

    /**
     * Requests left in the current window, -1 when limiting is disabled.
     */
    public int getRemaining() {
        return remaining;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
