package com.bank.p2pfraud.engine.model;

import com.bank.p2pfraud.model.ModelStatus;

/**
 * Binary fraud classifier over the {@link FeatureExtractor} vector.
 */
public interface FraudScorer {

    /**
     * @param features a vector of {@link FeatureExtractor#FEATURE_COUNT} raw (unscaled) values
     * @return fraud probability in [0,1]
     */
    double predict(double[] features);

    ModelStatus getStatus();
}
