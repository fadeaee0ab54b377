package com.bank.p2pfraud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VelocityLimits {
    @Builder.Default
    private double maxAmount1h = 5000.0;
    @Builder.Default
    private double maxAmount24h = 10000.0;
    @Builder.Default
    private int maxCount1h = 10;
    @Builder.Default
    private int maxCount24h = 50;
    @Builder.Default
    private int maxUniqueRecipients24h = 20;
}
