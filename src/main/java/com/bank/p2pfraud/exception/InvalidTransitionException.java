package com.bank.p2pfraud.exception;

public class InvalidTransitionException extends FraudWorkflowException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
