package com.opensiddur.settings;

import com.opensiddur.models.FeatureValue;
import com.opensiddur.models.ScopeOwner;

/**
 * One declared value of a feature and the declare block that put it there.
 */
public record ScopeFrame(FeatureValue value, ScopeOwner owner) {
}
