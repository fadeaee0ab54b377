package com.bank.p2pfraud.engine;

import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;

/**
 * Interface for all risk rule evaluators.
 * Each implementation handles a specific RuleType.
 */
public interface RuleEvaluator {

    /**
     * The rule type this evaluator handles.
     */
    RuleType getSupportedRuleType();

    /**
     * Evaluate a proposed payment.
     *
     * @param request the payment as submitted
     * @param context policy, sender and history inputs
     * @return the contribution of this rule, with a factor string when triggered
     */
    RuleResult evaluate(PaymentRequest request, EvaluationContext context);
}
