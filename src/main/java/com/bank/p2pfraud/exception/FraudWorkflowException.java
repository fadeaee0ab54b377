package com.bank.p2pfraud.exception;

/**
 * Root of the exceptions surfaced by the payment, case and ledger services.
 */
public abstract class FraudWorkflowException extends RuntimeException {

    protected FraudWorkflowException(String message) {
        super(message);
    }

    protected FraudWorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
