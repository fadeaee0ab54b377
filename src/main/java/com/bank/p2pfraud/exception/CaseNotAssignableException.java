package com.bank.p2pfraud.exception;

public class CaseNotAssignableException extends FraudWorkflowException {

    public CaseNotAssignableException(String message) {
        super(message);
    }
}
