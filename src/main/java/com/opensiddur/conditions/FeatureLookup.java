package com.opensiddur.conditions;

import com.opensiddur.models.FeatureKey;
import com.opensiddur.models.FeatureValue;

/**
 * Source of current feature values at the point being compiled.
 */
@FunctionalInterface
public interface FeatureLookup {

    /**
     * Current value; {@link FeatureValue#defaultValue()} when nothing was declared.
     */
    FeatureValue current(FeatureKey key);
}
