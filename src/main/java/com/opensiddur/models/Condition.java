package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Condition expression of a {@link ConditionalBlock}: a feature comparison or a
 * combinator over sub-conditions.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FeatureCondition.class, name = "feature"),
    @JsonSubTypes.Type(value = CombinatorCondition.All.class, name = "all"),
    @JsonSubTypes.Type(value = CombinatorCondition.Any.class, name = "any"),
    @JsonSubTypes.Type(value = CombinatorCondition.None.class, name = "none"),
    @JsonSubTypes.Type(value = CombinatorCondition.One.class, name = "one")
})
public abstract class Condition {
}
