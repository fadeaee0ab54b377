package com.bank.p2pfraud.model;

public enum CaseStatus {
    ASSIGNED("Assigned"),      // queued, no investigator yet
    IN_REVIEW("In Review"),
    RESOLVED("Resolved");

    private final String label;

    CaseStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
