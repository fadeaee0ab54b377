package com.bank.p2pfraud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-transaction risk metadata. Kept typed in memory; serialized to a single
 * JSON bin only by the transaction repository.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionDetails {

    @Builder.Default
    private List<String> riskFactors = new ArrayList<>();

    // null when the predictive scorer was unavailable
    private Double mlProbability;

    private double ruleScore;
    private double finalScore;

    // true when funds moved at submission time
    private boolean processed;

    private boolean scoringFallback;

    @Builder.Default
    private Map<String, Boolean> fraudIndicators = new LinkedHashMap<>();

    @Builder.Default
    private List<String> velocityViolations = new ArrayList<>();

    private VelocitySnapshot velocity;

    @Builder.Default
    private List<String> suspiciousPatterns = new ArrayList<>();

    private DeviceAssessment device;

    // set when a fraudulent finding could not claw back an already-moved transfer
    private Boolean reversalShortfall;

    // ADMIN_ADJUSTMENT only
    private String adjustedBy;
    private BalanceAdjustmentType adjustmentType;
    private Double balanceBefore;
    private Double balanceAfter;
}
