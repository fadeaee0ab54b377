package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEvaluator;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Detects automation and emulation in the device signature.
 *
 * Logic: the lower-cased signature is searched for each indicator keyword.
 * Any match adds 0.30 once; every matched keyword is listed in the factor,
 * in keyword order.
 */
@Component
public class SuspiciousDeviceEvaluator implements RuleEvaluator {

    private static final double WEIGHT = 0.30;
    private static final List<String> INDICATORS =
            List.of("bot", "headless", "automation", "emulator", "selenium", "phantom");

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.SUSPICIOUS_DEVICE;
    }

    @Override
    public RuleResult evaluate(PaymentRequest request, EvaluationContext context) {
        String device = request.getDeviceSignature();
        if (device == null || device.isEmpty()) {
            return RuleResult.notTriggered(getSupportedRuleType());
        }

        String lower = device.toLowerCase(Locale.ROOT);
        List<String> matched = INDICATORS.stream()
                .filter(lower::contains)
                .toList();

        if (matched.isEmpty()) {
            return RuleResult.notTriggered(getSupportedRuleType());
        }
        return RuleResult.triggered(getSupportedRuleType(), WEIGHT,
                "Suspicious device indicators: " + String.join(", ", matched));
    }
}
