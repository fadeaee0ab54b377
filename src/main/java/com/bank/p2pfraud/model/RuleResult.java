package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Evaluation result from a single risk rule")
public class RuleResult {

    @Schema(description = "Type of risk rule", example = "TRANSACTION_AMOUNT")
    private RuleType ruleType;

    @Schema(description = "Whether the rule contributed to the score", example = "true")
    private boolean triggered;

    @Schema(description = "Contribution to the rule score", example = "0.35")
    private double contribution;

    @Schema(description = "Human-readable risk factor; null when not triggered",
            example = "Large transaction amount exceeds $5000 limit")
    private String factor;

    public static RuleResult notTriggered(RuleType ruleType) {
        return new RuleResult(ruleType, false, 0.0, null);
    }

    public static RuleResult triggered(RuleType ruleType, double contribution, String factor) {
        return new RuleResult(ruleType, true, contribution, factor);
    }
}
