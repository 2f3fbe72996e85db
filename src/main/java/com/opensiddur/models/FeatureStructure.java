package com.opensiddur.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named set of feature assignments, e.g. structure "opensiddur:calendar" with
 * {@code gregorian-year = 2025}.
 */
public class FeatureStructure {
    private String name;
    private Map<String, FeatureValue> features = new LinkedHashMap<>();

    public FeatureStructure() {}

    public FeatureStructure(String name) {
        this.name = name;
    }

    public FeatureStructure(String name, Map<String, FeatureValue> features) {
        this.name = name;
        setFeatures(features);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Map<String, FeatureValue> getFeatures() { return features; }
    public void setFeatures(Map<String, FeatureValue> features) {
        this.features = features != null ? new LinkedHashMap<>(features) : new LinkedHashMap<>();
    }

    public FeatureStructure set(String feature, FeatureValue value) {
        features.put(feature, value);
        return this;
    }

    public FeatureStructure copy() {
        return new FeatureStructure(name, features);
    }
}
