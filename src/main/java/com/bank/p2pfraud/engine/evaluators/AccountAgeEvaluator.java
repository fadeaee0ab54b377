package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Young sender accounts: under 7 days adds 0.20, under 30 days adds 0.10.
 */
@Component
public class AccountAgeEvaluator implements RuleEvaluator {

    private static final double NEW_ACCOUNT_WEIGHT = 0.20;
    private static final double RECENT_ACCOUNT_WEIGHT = 0.10;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.ACCOUNT_AGE;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        Account sender = context.getSender();
        if (sender == null || sender.getCreatedAt() <= 0) {
            return RuleResult.notTriggered(getSupportedRuleType());
        }

        long ageDays = Duration.ofMillis(context.getSubmittedAtMillis() - sender.getCreatedAt()).toDays();

        if (ageDays < 7) {
            return RuleResult.triggered(getSupportedRuleType(), NEW_ACCOUNT_WEIGHT,
                    "New account (less than 7 days old)");
        }
        if (ageDays < 30) {
            return RuleResult.triggered(getSupportedRuleType(), RECENT_ACCOUNT_WEIGHT,
                    "Recently created account (less than 30 days)");
        }
        return RuleResult.notTriggered(getSupportedRuleType());
    }
}
