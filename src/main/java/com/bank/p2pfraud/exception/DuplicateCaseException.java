package com.bank.p2pfraud.exception;

public class DuplicateCaseException extends FraudWorkflowException {

    public DuplicateCaseException(String message) {
        super(message);
    }
}
