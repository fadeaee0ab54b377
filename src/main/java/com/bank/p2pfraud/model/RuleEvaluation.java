package com.bank.p2pfraud.model;

import java.util.List;

/**
 * Rule engine output: the capped rule score and the factors of triggered rules in evaluation order.
 */
public record RuleEvaluation(double ruleScore, List<String> factors, List<RuleResult> results) {}
