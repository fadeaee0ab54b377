package com.bank.p2pfraud.exception;

public class InsufficientFundsException extends FraudWorkflowException {

    private final double available;
    private final double required;

    public InsufficientFundsException(String accountId, double available, double required) {
        super(String.format("Insufficient balance on %s: available %.2f, required %.2f",
                accountId, available, required));
        this.available = available;
        this.required = required;
    }

    public double getAvailable() {
        return available;
    }

    public double getRequired() {
        return required;
    }
}
