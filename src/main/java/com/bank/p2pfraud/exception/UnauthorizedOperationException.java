package com.bank.p2pfraud.exception;

public class UnauthorizedOperationException extends FraudWorkflowException {

    public UnauthorizedOperationException(String message) {
        super(message);
    }
}
