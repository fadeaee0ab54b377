package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * 24-hour amount total, including this payment, above 10,000.
 */
@Component
public class VelocityAmountEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.20;
    private static final double MAX_DAILY_AMOUNT = 10000.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.VELOCITY_AMOUNT;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        double total = context.getVelocity().getAmount24h() + request.getAmount();
        if (total > MAX_DAILY_AMOUNT) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    String.format("High amount velocity: $%.2f in 24 hours", total));
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
