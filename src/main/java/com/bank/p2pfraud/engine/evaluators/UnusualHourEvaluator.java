package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class UnusualHourEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.15;
    private static final int EARLIEST_USUAL_HOUR = 6;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.UNUSUAL_HOUR;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        // 00:00 - 05:59 local time
        if (context.getSubmittedAt().getHour() < EARLIEST_USUAL_HOUR) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    "Transaction during unusual hours (night/early morning)");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
