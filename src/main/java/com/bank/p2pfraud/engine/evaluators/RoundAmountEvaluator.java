package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Round amounts of 500 or more (exact multiples of 100) are typical of manually keyed fraud.
 */
@Component
public class RoundAmountEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.25;
    private static final double MIN_AMOUNT = 500.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.ROUND_AMOUNT;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        double amount = request.getAmount();
        if (amount >= MIN_AMOUNT && amount % 100 == 0) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    "Round amount pattern detected (potential manual fraud)");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
