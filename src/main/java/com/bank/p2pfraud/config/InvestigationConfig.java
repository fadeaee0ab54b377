package com.bank.p2pfraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fraud.case")
public class InvestigationConfig {
    private int minReportLength = 100;
    private int maxConfidence = 100;
}
