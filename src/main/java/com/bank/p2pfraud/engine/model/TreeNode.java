package com.bank.p2pfraud.engine.model;

public class TreeNode {

    private int splitFeature;
    private double splitValue;
    private TreeNode left;
    private TreeNode right;
    private double fraudProbability; // fraction of fraud samples at a leaf
    private boolean leaf;

    public TreeNode() {}

    public static TreeNode internalNode(int splitFeature, double splitValue, TreeNode left, TreeNode right) {
        TreeNode node = new TreeNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        node.leaf = false;
        return node;
    }

    public static TreeNode leafNode(double fraudProbability) {
        TreeNode node = new TreeNode();
        node.fraudProbability = fraudProbability;
        node.leaf = true;
        return node;
    }

    public double predict(double[] point) {
        if (leaf) {
            return fraudProbability;
        }
        if (point[splitFeature] <= splitValue) {
            return left.predict(point);
        } else {
            return right.predict(point);
        }
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public TreeNode getLeft() { return left; }
    public TreeNode getRight() { return right; }
    public double getFraudProbability() { return fraudProbability; }
    public boolean isLeaf() { return leaf; }
}
