package com.bank.p2pfraud.engine.model;

import java.util.Random;

/**
 * Generates the labelled training populations for the fraud scorer, in
 * {@link FeatureExtractor} layout.
 *
 * Legitimate payments: log-normal amounts around e^4, daytime hours, rare
 * auth failures, low velocity, few new recipients, small share of balance.
 * Fraudulent payments: larger amounts, night hours, repeated auth failures,
 * risky locations and devices, high velocity, mostly new recipients.
 */
public final class SyntheticTrainingData {

    private static final int[] FRAUD_HOURS = {2, 3, 4, 23, 0, 1};
    private static final int[] FRAUD_FAILED_ATTEMPTS = {2, 3, 4, 5};
    private static final double[] FRAUD_FAILED_ATTEMPT_WEIGHTS = {0.3, 0.3, 0.2, 0.2};

    private SyntheticTrainingData() {}

    public record TrainingSet(double[][] features, int[] labels) {
        public int size() {
            return labels.length;
        }
    }

    public static TrainingSet generate(int normalCount, int fraudCount, Random random) {
        int total = normalCount + fraudCount;
        double[][] features = new double[total][];
        int[] labels = new int[total];

        for (int i = 0; i < normalCount; i++) {
            features[i] = normalSample(random);
            labels[i] = 0;
        }
        for (int i = normalCount; i < total; i++) {
            features[i] = fraudSample(random);
            labels[i] = 1;
        }
        return new TrainingSet(features, labels);
    }

    private static double[] normalSample(Random random) {
        double[] f = new double[FeatureExtractor.FEATURE_COUNT];
        f[0] = logNormal(random, 4, 1);
        f[1] = 6 + random.nextInt(17);          // 06:00 - 22:59
        f[2] = random.nextInt(7);
        f[3] = bernoulli(random, 0.1);
        f[4] = 0;
        f[5] = 0;
        f[6] = exponential(random, 50);
        f[7] = exponential(random, 200);
        f[8] = poisson(random, 1);
        f[9] = poisson(random, 5);
        f[10] = bernoulli(random, 0.3);
        f[11] = random.nextDouble() * 0.3;
        f[12] = bernoulli(random, 0.2);
        return f;
    }

    private static double[] fraudSample(Random random) {
        double[] f = new double[FeatureExtractor.FEATURE_COUNT];
        f[0] = logNormal(random, 6, 1.5);
        f[1] = FRAUD_HOURS[random.nextInt(FRAUD_HOURS.length)];
        f[2] = random.nextInt(7);
        f[3] = weightedChoice(random, FRAUD_FAILED_ATTEMPTS, FRAUD_FAILED_ATTEMPT_WEIGHTS);
        f[4] = bernoulli(random, 0.7);
        f[5] = bernoulli(random, 0.6);
        f[6] = exponential(random, 500);
        f[7] = exponential(random, 2000);
        f[8] = poisson(random, 5);
        f[9] = poisson(random, 20);
        f[10] = bernoulli(random, 0.7);
        f[11] = 0.5 + random.nextDouble() * 0.5;
        f[12] = bernoulli(random, 0.6);
        return f;
    }

    static double logNormal(Random random, double mu, double sigma) {
        return Math.exp(mu + sigma * random.nextGaussian());
    }

    static double exponential(Random random, double scale) {
        return -scale * Math.log(1.0 - random.nextDouble());
    }

    // Knuth's multiplication method, fine for the small lambdas used here
    static int poisson(Random random, double lambda) {
        double limit = Math.exp(-lambda);
        int k = 0;
        double p = 1.0;
        do {
            k++;
            p *= random.nextDouble();
        } while (p > limit);
        return k - 1;
    }

    private static double bernoulli(Random random, double p) {
        return random.nextDouble() < p ? 1.0 : 0.0;
    }

    private static int weightedChoice(Random random, int[] values, double[] weights) {
        double r = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < values.length; i++) {
            cumulative += weights[i];
            if (r < cumulative) return values[i];
        }
        return values[values.length - 1];
    }
}
