package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;

@Component
public class WeekendEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.05;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.WEEKEND;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        DayOfWeek day = context.getSubmittedAt().getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT, "Weekend transaction pattern");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
