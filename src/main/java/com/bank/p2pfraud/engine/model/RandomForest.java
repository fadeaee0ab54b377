package com.bank.p2pfraud.engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class RandomForest {

    private List<DecisionTree> trees;
    private int numFeatures;

    public RandomForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * Train the forest on labelled data.
     *
     * @param data           training samples, each row is a (scaled) feature vector
     * @param labels         1 for fraud, 0 for legitimate
     * @param numTrees       number of trees in the forest (typically 100)
     * @param maxDepth       depth limit per tree
     * @param minSamplesLeaf minimum samples on each side of a split
     * @param seed           random seed for reproducibility
     */
    public void train(double[][] data, int[] labels, int numTrees, int maxDepth, int minSamplesLeaf, long seed) {
        this.numFeatures = data[0].length;
        int maxFeatures = Math.max(1, (int) Math.round(Math.sqrt(numFeatures)));
        this.trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            int[] bootstrap = bootstrap(data.length, random);
            trees.add(DecisionTree.build(data, labels, bootstrap, maxDepth, minSamplesLeaf, maxFeatures, random));
        }
    }

    /**
     * Mean of the per-tree leaf fraud fractions.
     *
     * @return probability between 0.0 (legitimate) and 1.0 (fraud)
     */
    public double predictProbability(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double sum = 0.0;
        for (DecisionTree tree : trees) {
            sum += tree.predict(point);
        }
        return sum / trees.size();
    }

    /**
     * Mean impurity decrease per feature, each tree normalized to sum to 1.
     */
    public double[] featureImportances() {
        double[] importances = new double[numFeatures];
        if (trees.isEmpty()) return importances;

        for (DecisionTree tree : trees) {
            double[] decrease = tree.getImpurityDecrease();
            double total = 0.0;
            for (double d : decrease) total += d;
            if (total <= 0) continue;
            for (int j = 0; j < numFeatures; j++) {
                importances[j] += decrease[j] / total;
            }
        }
        for (int j = 0; j < numFeatures; j++) {
            importances[j] /= trees.size();
        }
        return importances;
    }

    // Sampling with replacement
    private int[] bootstrap(int size, Random random) {
        int[] sample = new int[size];
        for (int i = 0; i < size; i++) {
            sample[i] = random.nextInt(size);
        }
        return sample;
    }

    public List<DecisionTree> getTrees() { return trees; }
    public int getNumFeatures() { return numFeatures; }
}
