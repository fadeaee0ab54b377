package com.bank.p2pfraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fraud.model")
public class ModelConfig {
    private int numTrees = 100;
    private int maxDepth = 12;
    private int minSamplesLeaf = 2;
    private long seed = 42L;
    private int normalSamples = 2000;   // synthetic legitimate payments
    private int fraudSamples = 500;     // synthetic fraudulent payments
}
