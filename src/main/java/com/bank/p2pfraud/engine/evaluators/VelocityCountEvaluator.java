package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * More than five counted payments from the sender in the last 24 hours.
 * Rejected and blocked payments are not in the velocity snapshot and so never count.
 */
@Component
public class VelocityCountEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.25;
    private static final int MAX_DAILY_COUNT = 5;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.VELOCITY_COUNT;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        int count24h = context.getVelocity().getCount24h();
        if (count24h > MAX_DAILY_COUNT) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    "High transaction velocity: " + count24h + " transactions in 24 hours");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
