package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Each failed authentication attempt before the payment adds 0.05, up to 0.20.
 */
@Component
public class FailedAuthenticationEvaluator implements RuleEvaluator {

    private static final double PER_ATTEMPT = 0.05;
    private static final double MAX_CONTRIBUTION = 0.20;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.FAILED_AUTHENTICATION;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        int attempts = request.getFailedAttempts();
        if (attempts <= 0) {
            return RuleResult.notTriggered(getSupportedRuleType());
        }
        return RuleResult.triggered(getSupportedRuleType(),
                Math.min(MAX_CONTRIBUTION, attempts * PER_ATTEMPT),
                "Multiple authentication attempts: " + attempts);
    }
}
