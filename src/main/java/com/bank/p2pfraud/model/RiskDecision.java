package com.bank.p2pfraud.model;

/**
 * Result of the decision policy. {@code mlProbability} is null when the
 * decision fell back to the rule score alone.
 */
public record RiskDecision(Double mlProbability,
                           double ruleScore,
                           double finalScore,
                           PaymentOutcome outcome) {

    public boolean isFundsMoveNow() {
        return outcome.isFundsMoveNow();
    }

    public boolean isScoringFallback() {
        return mlProbability == null;
    }
}
