package com.bank.p2pfraud.exception;

public class AlreadyResolvedException extends FraudWorkflowException {

    public AlreadyResolvedException(String message) {
        super(message);
    }
}
