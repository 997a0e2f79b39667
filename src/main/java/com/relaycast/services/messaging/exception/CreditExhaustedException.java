package com.relaycast.services.messaging.exception;

import lombok.Getter;

/**
 * Thrown by the credit service when an org has no active top-up with remaining credit.
 */
@Getter
public class CreditExhaustedException extends RuntimeException {

    private final Long orgId;

    public CreditExhaustedException(Long orgId) {
        super("No credit remaining for org " + orgId);
        this.orgId = orgId;
    }
}
