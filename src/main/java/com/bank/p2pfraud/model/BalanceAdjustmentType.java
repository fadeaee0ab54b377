package com.bank.p2pfraud.model;

public enum BalanceAdjustmentType {
    ADD("Add Funds"),
    DEDUCT("Deduct Funds"),
    SET("Set Balance");

    private final String label;

    BalanceAdjustmentType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Deductions never take a balance below zero. */
    public double apply(double currentBalance, double amount) {
        return switch (this) {
            case ADD -> currentBalance + amount;
            case DEDUCT -> Math.max(0.0, currentBalance - amount);
            case SET -> amount;
        };
    }
}
