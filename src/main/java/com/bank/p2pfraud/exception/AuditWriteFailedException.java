package com.bank.p2pfraud.exception;

public class AuditWriteFailedException extends FraudWorkflowException {

    public AuditWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
