package com.openmeet.oidc.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process RateLimiter; counters are AtomicLongs per (key, window).
 */
public class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final FixedWindow window;

    public InMemoryRateLimiter(Clock clock, int maxRequests, Duration window) {
        this.clock = clock;
        this.window = new FixedWindow(maxRequests, window);
    }

    @Override
    public RateLimitResult hit(String key) {
        Instant now = clock.instant();
        long index = window.index(now);
        Counter counter = counters.compute(key, (k, existing) ->
            existing == null || existing.index != index ? new Counter(index) : existing);
        long count = counter.hits.incrementAndGet();
        if (count == 1 && counters.size() > 10_000) {
            counters.values().removeIf(c -> c.index < index);
        }
        return window.evaluate(count, index, now);
    }

    private static final class Counter {
        final long index;
        final AtomicLong hits = new AtomicLong();

        Counter(long index) {
            this.index = index;
        }
    }
}
