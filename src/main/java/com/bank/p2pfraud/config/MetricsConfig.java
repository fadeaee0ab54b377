package com.bank.p2pfraud.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPaymentOutcome(String outcome, double finalScore) {
        Counter.builder("payment.outcome.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("payment.final_score")
                .tag("outcome", outcome)
                .register(registry)
                .record(finalScore);
    }

    public void recordRuleTriggered(String ruleType) {
        Counter.builder("rule.triggered.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordScorerFallback() {
        registry.counter("scorer.fallback.count").increment();
    }

    public void recordCaseResolved(String finding) {
        Counter.builder("case.resolved.count")
                .tag("finding", finding)
                .register(registry)
                .increment();
    }

    public void recordAdminOverride(boolean approved) {
        Counter.builder("admin.override.count")
                .tag("approved", String.valueOf(approved))
                .register(registry)
                .increment();
    }

    public void recordBalanceAdjustment(String type) {
        Counter.builder("admin.balance.adjustment.count")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordAuditFailure() {
        registry.counter("audit.write.failure.count").increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
