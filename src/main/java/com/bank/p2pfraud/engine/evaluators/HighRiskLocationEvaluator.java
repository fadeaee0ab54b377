package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class HighRiskLocationEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.30;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.HIGH_RISK_LOCATION;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        String location = request.getLocation();
        if (context.getSettings().isHighRiskLocation(location)) {
            return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                    "High-risk geographic location: " + location);
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
