package com.bank.p2pfraud.config;

import com.bank.p2pfraud.model.Settings;
import com.bank.p2pfraud.model.VelocityLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for the persisted policy record. Used until an administrator saves
 * a policy, and by the seeder to initialise storage.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fraud.policy")
public class FraudPolicyConfig {

    private double txLimitAmount = 5000.0;

    private int maxFailedAttempts = 3;

    // final score >= flagThreshold -> Flagged (funds still move)
    private double flagThreshold = 0.4;

    // final score >= blockThreshold -> Blocked (funds held for investigation)
    private double blockThreshold = 0.7;

    private double defaultUserBalance = 2000.0;

    private List<String> highRiskLocations = List.of("Unknown", "High-Risk-Geo", "Tor-Exit-Node", "VPN-Detected");

    private boolean enableNotifications = true;

    private VelocityLimits velocityLimits = new VelocityLimits();

    public Settings toSettings() {
        return Settings.builder()
                .txLimitAmount(txLimitAmount)
                .maxFailedAttempts(maxFailedAttempts)
                .flagThreshold(flagThreshold)
                .blockThreshold(blockThreshold)
                .defaultUserBalance(defaultUserBalance)
                .highRiskLocations(new ArrayList<>(highRiskLocations))
                .enableNotifications(enableNotifications)
                .velocityLimits(velocityLimits.toBuilder().build())
                .build();
    }
}
