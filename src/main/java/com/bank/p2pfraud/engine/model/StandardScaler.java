package com.bank.p2pfraud.engine.model;

/**
 * Per-feature standardization, (x - mean) / stdDev, with statistics fit once on the training set.
 */
public class StandardScaler {

    private double[] means;
    private double[] stdDevs;

    public void fit(double[][] data) {
        int dims = data[0].length;
        means = new double[dims];
        stdDevs = new double[dims];

        for (double[] row : data) {
            for (int j = 0; j < dims; j++) means[j] += row[j];
        }
        for (int j = 0; j < dims; j++) means[j] /= data.length;

        for (double[] row : data) {
            for (int j = 0; j < dims; j++) {
                double d = row[j] - means[j];
                stdDevs[j] += d * d;
            }
        }
        for (int j = 0; j < dims; j++) {
            double std = Math.sqrt(stdDevs[j] / data.length);
            // constant feature: leave it centred only
            stdDevs[j] = std > 0 ? std : 1.0;
        }
    }

    public double[] transform(double[] point) {
        if (means == null) {
            throw new IllegalStateException("Scaler has not been fit");
        }
        if (point.length != means.length) {
            throw new IllegalArgumentException(
                    "Expected " + means.length + " features, got " + point.length);
        }
        double[] scaled = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            scaled[j] = (point[j] - means[j]) / stdDevs[j];
        }
        return scaled;
    }

    public double[][] transformAll(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) scaled[i] = transform(data[i]);
        return scaled;
    }
}
