package com.opensiddur.models;

/**
 * Compares the current value of one feature against an expected value.
 */
public class FeatureCondition extends Condition {
    private String structure;
    private String feature;
    private FeatureValue value;

    public FeatureCondition() {}

    public FeatureCondition(String structure, String feature, FeatureValue value) {
        this.structure = structure;
        this.feature = feature;
        this.value = value;
    }

    public String getStructure() { return structure; }
    public void setStructure(String structure) { this.structure = structure; }

    public String getFeature() { return feature; }
    public void setFeature(String feature) { this.feature = feature; }

    public FeatureValue getValue() { return value; }
    public void setValue(FeatureValue value) { this.value = value; }

    public FeatureKey key() {
        return FeatureKey.of(structure, feature);
    }
}
