package com.bank.p2pfraud.exception;

/** Bad input, unknown or unapproved account. Raised before any state change. */
public class ValidationException extends FraudWorkflowException {

    public ValidationException(String message) {
        super(message);
    }
}
