package com.opensiddur.conditions;

import com.opensiddur.models.FeatureValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureMatcherTest {

    @Test
    void defaultOnEitherSideIsUndefined() {
        assertEquals(Truth.UNDEFINED, FeatureMatcher.match(FeatureValue.defaultValue(), FeatureValue.ofBoolean(true)));
        assertEquals(Truth.UNDEFINED, FeatureMatcher.match(null, FeatureValue.ofBoolean(true)));
        assertEquals(Truth.UNDEFINED, FeatureMatcher.match(FeatureValue.ofBoolean(true), null));
    }

    @Test
    void negationOfUnsetStaysUndefined() {
        assertEquals(Truth.UNDEFINED,
            FeatureMatcher.match(FeatureValue.undefined(), FeatureValue.not(FeatureValue.ofString("x"))));
    }

    @Test
    void numbersAndRanges() {
        assertEquals(Truth.TRUE, FeatureMatcher.match(FeatureValue.ofNumber(5), FeatureValue.ofNumber(5)));
        assertEquals(Truth.FALSE, FeatureMatcher.match(FeatureValue.ofNumber(5), FeatureValue.ofNumber(6)));
        assertEquals(Truth.TRUE, FeatureMatcher.match(FeatureValue.ofRange(3, 4), FeatureValue.ofRange(1, 10)));
        assertEquals(Truth.FALSE, FeatureMatcher.match(FeatureValue.ofRange(11, 12), FeatureValue.ofRange(1, 10)));
        assertEquals(Truth.UNDEFINED, FeatureMatcher.match(FeatureValue.ofRange(8, 12), FeatureValue.ofRange(1, 10)));
    }

    @Test
    void alternationWithUndefinedMember() {
        FeatureValue expected = FeatureValue.alternation(List.of(FeatureValue.ofString("a"), FeatureValue.undefined()));
        assertEquals(Truth.TRUE, FeatureMatcher.match(FeatureValue.ofString("a"), expected));
        assertEquals(Truth.UNDEFINED, FeatureMatcher.match(FeatureValue.ofString("b"), expected));
    }

    @Test
    void differentKindsNeverMatch() {
        assertEquals(Truth.FALSE, FeatureMatcher.match(FeatureValue.ofString("1"), FeatureValue.ofNumber(1)));
    }
}
