package com.bank.p2pfraud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The single keyed policy record ("system"). Instances handed out by the
 * settings service are copies; callers never mutate the live policy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Fraud policy: amount ceiling, decision thresholds, velocity limits and high-risk locations")
public class Settings {

    @Schema(description = "Single-payment amount ceiling in USD", example = "5000.0")
    private double txLimitAmount;

    @Schema(description = "Failed authentication attempts tolerated before a payment is marked as an auth-failure risk", example = "3")
    private int maxFailedAttempts;

    @Schema(description = "Scores at or above this are Flagged (funds still move)", example = "0.4")
    private double flagThreshold;

    @Schema(description = "Scores at or above this are Blocked (funds held)", example = "0.7")
    private double blockThreshold;

    @Schema(description = "Balance granted when an account is approved", example = "2000.0")
    private double defaultUserBalance;

    @Schema(description = "Declared locations treated as high risk")
    @Builder.Default
    private List<String> highRiskLocations = new ArrayList<>();

    @Schema(description = "Send notifications for blocked or rejected payments", example = "true")
    private boolean enableNotifications;

    @Schema(description = "Rolling-window velocity limits")
    @Builder.Default
    private VelocityLimits velocityLimits = new VelocityLimits();

    public Settings copy() {
        return toBuilder()
                .highRiskLocations(new ArrayList<>(highRiskLocations))
                .velocityLimits(velocityLimits.toBuilder().build())
                .build();
    }

    public boolean isHighRiskLocation(String location) {
        return location != null && highRiskLocations.contains(location);
    }
}
