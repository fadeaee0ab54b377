package com.bank.p2pfraud.model;

/**
 * Outcome of the risk decision policy for a newly submitted payment.
 */
public enum PaymentOutcome {
    SETTLED(TransactionStatus.SETTLED, true),
    FLAGGED(TransactionStatus.FLAGGED, true),
    BLOCKED(TransactionStatus.BLOCKED, false);

    private final TransactionStatus initialStatus;
    private final boolean fundsMoveNow;

    PaymentOutcome(TransactionStatus initialStatus, boolean fundsMoveNow) {
        this.initialStatus = initialStatus;
        this.fundsMoveNow = fundsMoveNow;
    }

    public TransactionStatus getInitialStatus() {
        return initialStatus;
    }

    public boolean isFundsMoveNow() {
        return fundsMoveNow;
    }

    public boolean requiresCase() {
        return this != SETTLED;
    }

    public CasePriority casePriority() {
        return this == BLOCKED ? CasePriority.HIGH : CasePriority.MEDIUM;
    }
}
