package com.bank.p2pfraud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceAssessment {
    private String fingerprint;
    private double riskScore;
    private List<String> riskFactors;
}
