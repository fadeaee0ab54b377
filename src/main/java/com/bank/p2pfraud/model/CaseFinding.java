package com.bank.p2pfraud.model;

public enum CaseFinding {
    NONE(""),
    SAFE("Safe"),
    FRAUDULENT("Fraudulent");

    private final String label;

    CaseFinding(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
