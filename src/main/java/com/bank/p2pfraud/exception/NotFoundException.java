package com.bank.p2pfraud.exception;

public class NotFoundException extends FraudWorkflowException {

    public NotFoundException(String message) {
        super(message);
    }
}
