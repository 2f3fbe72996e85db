package com.opensiddur.conditions;

import com.opensiddur.models.FeatureValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares a feature's current value with the value a condition expects.
 *
 *   - either side UNDEFINED or DEFAULT  -> UNDEFINED
 *   - expected negation                 -> NOT(match against the negated value)
 *   - expected alternation              -> ANY over the alternatives
 *   - current alternation (a set)       -> ANY over the members
 *   - expected numeric range            -> current number within [number, max]
 *   - scalars                           -> equal or not; different kinds never match
 */
public final class FeatureMatcher {

    private FeatureMatcher() {}

    public static Truth match(FeatureValue current, FeatureValue expected) {
        if (expected == null) {
            expected = FeatureValue.defaultValue();
        }
        if (current == null) {
            current = FeatureValue.defaultValue();
        }
        if (expected.getKind() == FeatureValue.Kind.NEGATION) {
            return TruthTables.not(match(current, expected.getNegated()));
        }
        if (current.isUnset() || expected.isUnset()) {
            return Truth.UNDEFINED;
        }
        if (expected.getKind() == FeatureValue.Kind.ALTERNATION) {
            List<Truth> results = new ArrayList<>();
            for (FeatureValue alternative : expected.getAlternatives()) {
                results.add(match(current, alternative));
            }
            return TruthTables.any(results);
        }
        if (current.getKind() == FeatureValue.Kind.ALTERNATION) {
            List<Truth> results = new ArrayList<>();
            for (FeatureValue member : current.getAlternatives()) {
                results.add(match(member, expected));
            }
            return TruthTables.any(results);
        }
        if (current.getKind() == FeatureValue.Kind.NEGATION) {
            return TruthTables.not(match(current.getNegated(), expected));
        }
        if (current.getKind() != expected.getKind()) {
            return Truth.FALSE;
        }
        switch (current.getKind()) {
            case BOOLEAN:
                return Truth.of(Objects.equals(current.getBool(), expected.getBool()));
            case STRING:
                return Truth.of(Objects.equals(current.getString(), expected.getString()));
            case NUMERIC:
                return matchNumbers(current, expected);
            default:
                return Truth.UNDEFINED;
        }
    }

    private static Truth matchNumbers(FeatureValue current, FeatureValue expected) {
        double low = expected.getNumber();
        double high = expected.isRange() ? expected.getMax() : low;
        double currentLow = current.getNumber();
        double currentHigh = current.isRange() ? current.getMax() : currentLow;
        if (currentLow >= low && currentHigh <= high) {
            return Truth.TRUE;
        }
        if (currentHigh < low || currentLow > high) {
            return Truth.FALSE;
        }
        // a declared range that only partly overlaps the expected one
        return Truth.UNDEFINED;
    }
}
