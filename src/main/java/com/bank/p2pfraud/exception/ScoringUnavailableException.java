package com.bank.p2pfraud.exception;

public class ScoringUnavailableException extends FraudWorkflowException {

    public ScoringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
