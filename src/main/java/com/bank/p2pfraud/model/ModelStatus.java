package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "State of the fraud scorer")
public class ModelStatus {

    @Schema(description = "Whether the scorer has been trained in this process", example = "true")
    private boolean trained;

    @Schema(description = "Number of trees in the forest", example = "100")
    private int numTrees;

    @Schema(description = "Synthetic samples used for training", example = "2500")
    private int trainingSamples;

    @Schema(description = "Accuracy on the training set", example = "0.998")
    private double trainingAccuracy;

    @Schema(description = "Epoch millis when training completed; 0 if untrained")
    private long trainedAt;

    @Schema(description = "Mean impurity decrease per feature, by feature name")
    private Map<String, Double> featureImportance;
}
