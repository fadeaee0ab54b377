package com.bank.p2pfraud.model;

/**
 * Lifecycle of a payment. The initial state is assigned by the decision policy
 * (SETTLED / FLAGGED / BLOCKED); only BLOCKED waits on a case or an override.
 */
public enum TransactionStatus {
    SETTLED("Success"),
    FLAGGED("Under Review"),
    BLOCKED("Pending Approval"),
    SETTLED_BY_OVERRIDE("Success (Admin Override)"),
    REJECTED_FRAUDULENT("Rejected - Fraudulent"),
    REJECTED_INSUFFICIENT_FUNDS("Rejected - Insufficient Balance");

    private final String label;

    TransactionStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Only settled and under-review payments count toward rolling velocity windows. */
    public boolean countsTowardVelocity() {
        return this == SETTLED || this == FLAGGED;
    }
}
