package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One base regressor of the ensemble. Only the hyper-parameters relevant to
 * {@link #getType()} are read; the rest keep their defaults.
 */
public class RegressorConfig {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private RegressorType type;

    @JsonProperty("alpha")
    private double alpha = 1.0;

    @JsonProperty("trees")
    private int trees = 100;

    @JsonProperty("max-depth")
    private int maxDepth = 6;

    @JsonProperty("max-nodes")
    private int maxNodes = 64;

    @JsonProperty("node-size")
    private int nodeSize = 5;

    @JsonProperty("shrinkage")
    private double shrinkage = 0.1;

    @JsonProperty("subsample")
    private double subsample = 1.0;

    /** Features tried per split; 0 means one third of the predictors. */
    @JsonProperty("mtry")
    private int mtry = 0;

    @JsonProperty("weight")
    private double weight = 1.0;

    public RegressorConfig() {
    }

    public RegressorConfig(String name, RegressorType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public RegressorType getType() {
        return type;
    }

    public void setType(RegressorType type) {
        this.type = type;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public int getTrees() {
        return trees;
    }

    public void setTrees(int trees) {
        this.trees = trees;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public void setMaxNodes(int maxNodes) {
        this.maxNodes = maxNodes;
    }

    public int getNodeSize() {
        return nodeSize;
    }

    public void setNodeSize(int nodeSize) {
        this.nodeSize = nodeSize;
    }

    public double getShrinkage() {
        return shrinkage;
    }

    public void setShrinkage(double shrinkage) {
        this.shrinkage = shrinkage;
    }

    public double getSubsample() {
        return subsample;
    }

    public void setSubsample(double subsample) {
        this.subsample = subsample;
    }

    public int getMtry() {
        return mtry;
    }

    public void setMtry(int mtry) {
        this.mtry = mtry;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }
}
