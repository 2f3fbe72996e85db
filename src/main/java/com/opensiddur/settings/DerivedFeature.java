package com.opensiddur.settings;

import com.opensiddur.conditions.FeatureLookup;
import com.opensiddur.models.FeatureKey;
import com.opensiddur.models.FeatureValue;

import java.util.List;
import java.util.function.Function;

/**
 * A feature computed from other features. It is UNDEFINED whenever any input is unset;
 * otherwise {@code rule} computes it from the current values.
 */
public class DerivedFeature {
    private final FeatureKey key;
    private final List<FeatureKey> inputs;
    private final Function<FeatureLookup, FeatureValue> rule;

    public DerivedFeature(FeatureKey key, List<FeatureKey> inputs, Function<FeatureLookup, FeatureValue> rule) {
        this.key = key;
        this.inputs = List.copyOf(inputs);
        this.rule = rule;
    }

    public FeatureKey getKey() {
        return key;
    }

    public List<FeatureKey> getInputs() {
        return inputs;
    }

    public FeatureValue compute(FeatureLookup lookup) {
        for (FeatureKey input : inputs) {
            if (lookup.current(input).isUnset()) {
                return FeatureValue.undefined();
            }
        }
        FeatureValue value = rule.apply(lookup);
        return value != null ? value : FeatureValue.undefined();
    }
}
