package com.bank.p2pfraud.engine.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

/**
 * CART classification tree grown on Gini impurity, considering a random
 * subset of features at every split.
 */
public class DecisionTree {

    private final TreeNode root;

    // Weighted impurity decrease per feature, accumulated while growing
    private final double[] impurityDecrease;

    public DecisionTree(TreeNode root, double[] impurityDecrease) {
        this.root = root;
        this.impurityDecrease = impurityDecrease;
    }

    public static DecisionTree build(double[][] data, int[] labels, int[] sampleIdx,
                                     int maxDepth, int minSamplesLeaf, int maxFeatures, Random random) {
        int numFeatures = data[0].length;
        double[] decrease = new double[numFeatures];
        Builder builder = new Builder(data, labels, maxDepth, minSamplesLeaf, maxFeatures, random, decrease);
        TreeNode root = builder.grow(sampleIdx, 0);
        return new DecisionTree(root, decrease);
    }

    public double predict(double[] point) {
        return root.predict(point);
    }

    public double[] getImpurityDecrease() { return impurityDecrease; }

    private static final class Builder {
        private final double[][] data;
        private final int[] labels;
        private final int maxDepth;
        private final int minSamplesLeaf;
        private final int maxFeatures;
        private final Random random;
        private final double[] decrease;
        private final int totalSamples;

        private Builder(double[][] data, int[] labels, int maxDepth, int minSamplesLeaf,
                        int maxFeatures, Random random, double[] decrease) {
            this.data = data;
            this.labels = labels;
            this.maxDepth = maxDepth;
            this.minSamplesLeaf = minSamplesLeaf;
            this.maxFeatures = maxFeatures;
            this.random = random;
            this.decrease = decrease;
            this.totalSamples = data.length;
        }

        private TreeNode grow(int[] idx, int depth) {
            int n = idx.length;
            int positives = countPositives(idx);
            double probability = n > 0 ? (double) positives / n : 0.0;

            if (depth >= maxDepth || n < 2 * minSamplesLeaf || positives == 0 || positives == n) {
                return TreeNode.leafNode(probability);
            }

            double parentGini = gini(positives, n);
            int bestFeature = -1;
            double bestThreshold = 0.0;
            double bestGini = parentGini;

            for (int feature : sampleFeatures(data[0].length)) {
                Integer[] sorted = sortByFeature(idx, feature);
                int leftPositives = 0;

                for (int i = 0; i < n - 1; i++) {
                    leftPositives += labels[sorted[i]];
                    int leftCount = i + 1;
                    double current = data[sorted[i]][feature];
                    double next = data[sorted[i + 1]][feature];

                    if (current == next) continue;
                    if (leftCount < minSamplesLeaf || n - leftCount < minSamplesLeaf) continue;

                    int rightCount = n - leftCount;
                    double weighted = (leftCount * gini(leftPositives, leftCount)
                            + rightCount * gini(positives - leftPositives, rightCount)) / n;

                    if (weighted < bestGini) {
                        bestGini = weighted;
                        bestFeature = feature;
                        bestThreshold = (current + next) / 2.0;
                    }
                }
            }

            if (bestFeature < 0) {
                return TreeNode.leafNode(probability);
            }

            decrease[bestFeature] += ((double) n / totalSamples) * (parentGini - bestGini);

            int leftSize = 0;
            for (int i : idx) {
                if (data[i][bestFeature] <= bestThreshold) leftSize++;
            }
            int[] leftIdx = new int[leftSize];
            int[] rightIdx = new int[n - leftSize];
            int li = 0, ri = 0;
            for (int i : idx) {
                if (data[i][bestFeature] <= bestThreshold) {
                    leftIdx[li++] = i;
                } else {
                    rightIdx[ri++] = i;
                }
            }

            TreeNode left = grow(leftIdx, depth + 1);
            TreeNode right = grow(rightIdx, depth + 1);
            return TreeNode.internalNode(bestFeature, bestThreshold, left, right);
        }

        private int countPositives(int[] idx) {
            int count = 0;
            for (int i : idx) count += labels[i];
            return count;
        }

        private Integer[] sortByFeature(int[] idx, int feature) {
            Integer[] sorted = new Integer[idx.length];
            for (int i = 0; i < idx.length; i++) sorted[i] = idx[i];
            Arrays.sort(sorted, Comparator.comparingDouble(i -> data[i][feature]));
            return sorted;
        }

        // Partial Fisher-Yates over feature indices
        private int[] sampleFeatures(int numFeatures) {
            int[] features = new int[numFeatures];
            for (int i = 0; i < numFeatures; i++) features[i] = i;
            int k = Math.min(maxFeatures, numFeatures);
            for (int i = 0; i < k; i++) {
                int j = i + random.nextInt(numFeatures - i);
                int tmp = features[i];
                features[i] = features[j];
                features[j] = tmp;
            }
            return Arrays.copyOf(features, k);
        }

        private static double gini(int positives, int count) {
            if (count == 0) return 0.0;
            double p = (double) positives / count;
            return 2.0 * p * (1.0 - p);
        }
    }
}
