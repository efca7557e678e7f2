package com.openmeet.oidc.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Window arithmetic shared by the RateLimiter implementations.
 */
final class FixedWindow {

    private final int maxRequests;
    private final long windowMillis;

    FixedWindow(int maxRequests, Duration window) {
        if (maxRequests < 1 || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("maxRequests and window must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
    }

    long index(Instant now) {
        return now.toEpochMilli() / windowMillis;
    }

    Duration remainingIn(long index, Instant now) {
        long end = (index + 1) * windowMillis;
        return Duration.ofMillis(Math.max(end - now.toEpochMilli(), 0));
    }

    Duration length() {
        return Duration.ofMillis(windowMillis);
    }

    RateLimitResult evaluate(long count, long index, Instant now) {
        if (count > maxRequests) {
            return RateLimitResult.block(remainingIn(index, now));
        }
        return RateLimitResult.allow((int) (maxRequests - count));
    }
}
