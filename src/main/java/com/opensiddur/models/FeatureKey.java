package com.opensiddur.models;

public record FeatureKey(String structure, String feature) {

    public static FeatureKey of(String structure, String feature) {
        return new FeatureKey(structure, feature);
    }

    @Override
    public String toString() {
        return structure + "->" + feature;
    }
}
