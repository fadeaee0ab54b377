package com.bank.p2pfraud.model;

import java.util.List;

public record VelocityCheckResult(List<String> violations, VelocitySnapshot snapshot) {

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
