package com.bank.p2pfraud.engine;

import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleEvaluation;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates every registered risk rule against a payment and accumulates the rule score.
 * Uses the Strategy pattern: each RuleType is handled by a registered RuleEvaluator.
 *
 * <p>Rules run in {@link RuleType} declaration order, so the factor list is
 * reproducible for the same inputs. The score is the sum of contributions,
 * capped at 1.0.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private static final double MAX_RULE_SCORE = 1.0;

    private final Map<RuleType, RuleEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleEvaluator> evaluators, Tracer tracer, MetricsConfig metricsConfig) {
        this.evaluatorMap = new EnumMap<>(RuleType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedRuleType(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleType(), evaluator.getClass().getSimpleName());
        }
    }

    public RuleEvaluation evaluateAll(PaymentRequest request, EvaluationContext context) {
        List<RuleResult> results = new ArrayList<>();
        List<String> factors = new ArrayList<>();
        double total = 0.0;

        // EnumMap iterates in ordinal order
        for (Map.Entry<RuleType, RuleEvaluator> entry : evaluatorMap.entrySet()) {
            RuleType ruleType = entry.getKey();

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + ruleType)
                    .tag("rule.type", ruleType.name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleResult result = entry.getValue().evaluate(request, context);
                results.add(result);

                ruleSpan.tag("rule.triggered", String.valueOf(result.isTriggered()));

                if (result.isTriggered()) {
                    total += result.getContribution();
                    factors.add(result.getFactor());
                    ruleSpan.tag("rule.contribution", String.valueOf(result.getContribution()));
                    metricsConfig.recordRuleTriggered(ruleType.name());
                    log.debug("Rule triggered: {} for sender {} - contribution={}, factor={}",
                            ruleType, request.getSenderId(), result.getContribution(), result.getFactor());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} for sender {}: {}",
                        ruleType, request.getSenderId(), e.getMessage(), e);
                // A failing rule contributes nothing; the others still run
            } finally {
                ruleSpan.end();
            }
        }

        return new RuleEvaluation(Math.min(MAX_RULE_SCORE, total), factors, results);
    }
}
