package com.openmeet.oidc.replay;

import java.time.Instant;

/**
 * Marker that a code has been redeemed. Its existence is authoritative.
 */
public final class ConsumedCodeRecord {

    private final String tenantId;
    private final String codeId;
    private final Instant consumedAt;

    public ConsumedCodeRecord(String tenantId, String codeId, Instant consumedAt) {
        this.tenantId = tenantId;
        this.codeId = codeId;
        this.consumedAt = consumedAt;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getCodeId() {
        return codeId;
    }

    public Instant getConsumedAt() {
        return consumedAt;
    }
}
