package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Flags large payments in two tiers.
 *
 * Logic: amount above the configured single-payment limit adds 0.35;
 * otherwise an amount above 1,000 adds 0.20. The tiers are exclusive.
 */
@Component
public class TransactionAmountEvaluator implements RuleEvaluator {

    static final double OVER_LIMIT_WEIGHT = 0.35;
    static final double SIGNIFICANT_WEIGHT = 0.20;
    static final double SIGNIFICANT_AMOUNT = 1000.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.TRANSACTION_AMOUNT;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        double limit = context.getSettings().getTxLimitAmount();

        if (request.getAmount() > limit) {
            return RuleResult.triggered(getSupportedRuleType(), OVER_LIMIT_WEIGHT,
                    String.format("Large transaction amount exceeds $%.0f limit", limit));
        }
        if (request.getAmount() > SIGNIFICANT_AMOUNT) {
            return RuleResult.triggered(getSupportedRuleType(), SIGNIFICANT_WEIGHT,
                    "Significant transaction amount over $1,000");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
