package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Sub-dollar payments are a common card-testing pattern.
 */
@Component
public class MicroTransactionEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.40;
    private static final double MICRO_LIMIT = 1.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.MICRO_TRANSACTION;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        if (request.getAmount() < MICRO_LIMIT) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    "Micro-transaction pattern (potential card testing)");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
