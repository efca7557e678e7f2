package com.openmeet.oidc.replay;

/**
 * Records which authorization codes have been consumed.
 *
 * Entries live for the code lifetime; after that the code is rejected by its
 * own expiry and the record is no longer needed.
 */
public interface ReplayGuard {

    /**
     * Atomic check-and-insert. Of any number of concurrent calls for the same
     * (tenantId, codeId) exactly one returns true.
     *
     * @return true when this call recorded the first consumption
     */
    boolean tryConsume(String tenantId, String codeId);

    /**
     * Read-only check used to report a replay early. Never a substitute for
     * {@link #tryConsume}.
     */
    boolean isConsumed(String tenantId, String codeId);
}
