package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Detects a payment far above the sender's usual size.
 *
 * Logic: triggers when the amount exceeds 3x the mean of the sender's most
 * recent transactions. Senders with no history are never flagged here.
 */
@Component
public class AmountSpikeEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.15;
    private static final double SPIKE_MULTIPLIER = 3.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.AMOUNT_SPIKE;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        double average = context.getHistoricalAverageAmount();
        if (average <= 0) {
            return RuleResult.notTriggered(getSupportedRuleType());
        }
        if (request.getAmount() > average * SPIKE_MULTIPLIER) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    "Transaction amount significantly higher than user's typical pattern");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
