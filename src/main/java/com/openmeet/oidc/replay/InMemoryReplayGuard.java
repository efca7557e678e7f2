package com.openmeet.oidc.replay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process ReplayGuard on ConcurrentHashMap conditional writes.
 */
public class InMemoryReplayGuard implements ReplayGuard {

    private static final int SWEEP_INTERVAL = 256;

    private final ConcurrentMap<String, ConsumedCodeRecord> consumed = new ConcurrentHashMap<>();
    private final AtomicLong inserts = new AtomicLong();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryReplayGuard(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public boolean tryConsume(String tenantId, String codeId) {
        Instant now = clock.instant();
        String key = key(tenantId, codeId);
        ConsumedCodeRecord record = new ConsumedCodeRecord(tenantId, codeId, now);
        ConsumedCodeRecord existing = consumed.putIfAbsent(key, record);
        if (existing != null) {
            if (!isLive(existing, now)) {
                // stale record: only one racer can win the replace
                return consumed.replace(key, existing, record);
            }
            return false;
        }
        if (inserts.incrementAndGet() % SWEEP_INTERVAL == 0) {
            consumed.values().removeIf(r -> !isLive(r, now));
        }
        return true;
    }

    @Override
    public boolean isConsumed(String tenantId, String codeId) {
        ConsumedCodeRecord record = consumed.get(key(tenantId, codeId));
        return record != null && isLive(record, clock.instant());
    }

    private boolean isLive(ConsumedCodeRecord record, Instant now) {
        return now.isBefore(record.getConsumedAt().plus(ttl));
    }

    private static String key(String tenantId, String codeId) {
        return tenantId + ':' + codeId;
    }
}
