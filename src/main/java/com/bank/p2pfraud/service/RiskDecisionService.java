package com.bank.p2pfraud.service;

import com.bank.p2pfraud.model.PaymentOutcome;
import com.bank.p2pfraud.model.RiskDecision;
import com.bank.p2pfraud.model.Settings;
import org.springframework.stereotype.Service;

/**
 * The single mapping from scores to a payment outcome.
 *
 * final = 0.7 x scorer probability + 0.3 x rule score, clamped to [0,1].
 * When the scorer was unavailable the rule score is used alone.
 *
 * Bands use strict lower bounds:
 *   score <  flag             -> SETTLED
 *   flag <= score < block     -> FLAGGED
 *   score >= block            -> BLOCKED
 *
 * Thresholds are read from the live policy on every call.
 */
@Service
public class RiskDecisionService {

    static final double MODEL_WEIGHT = 0.7;
    static final double RULE_WEIGHT = 0.3;

    private final SettingsService settingsService;

    public RiskDecisionService(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * @param mlProbability scorer output, or null when scoring fell back to rules only
     */
    public RiskDecision decide(Double mlProbability, double ruleScore) {
        double finalScore = mlProbability != null
                ? MODEL_WEIGHT * mlProbability + RULE_WEIGHT * ruleScore
                : ruleScore;
        finalScore = clamp(finalScore);

        return new RiskDecision(mlProbability, ruleScore, finalScore, classify(finalScore));
    }

    public PaymentOutcome classify(double finalScore) {
        Settings settings = settingsService.getSettings();
        if (finalScore >= settings.getBlockThreshold()) {
            return PaymentOutcome.BLOCKED;
        } else if (finalScore >= settings.getFlagThreshold()) {
            return PaymentOutcome.FLAGGED;
        }
        return PaymentOutcome.SETTLED;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) return 1.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
