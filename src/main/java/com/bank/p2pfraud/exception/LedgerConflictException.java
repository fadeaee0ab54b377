package com.bank.p2pfraud.exception;

/**
 * A multi-record transaction failed to commit because a record it read changed concurrently.
 * Nothing from the unit of work was applied.
 */
public class LedgerConflictException extends FraudWorkflowException {

    public LedgerConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
