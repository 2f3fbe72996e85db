package com.opensiddur.settings;

import com.opensiddur.errors.UnbalancedScopeException;
import com.opensiddur.models.FeatureKey;
import com.opensiddur.models.FeatureStructure;
import com.opensiddur.models.FeatureValue;
import com.opensiddur.models.ScopeOwner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTrackerTest {

    private static final String RITE = "opensiddur:rite";
    private static final FeatureKey NUSACH = FeatureKey.of(RITE, "nusach");
    private static final FeatureKey MOURNER = FeatureKey.of(RITE, "mourner");

    private final ScopeTracker tracker = new ScopeTracker();

    private static FeatureStructure rite(String feature, FeatureValue value) {
        return new FeatureStructure(RITE).set(feature, value);
    }

    private static FeatureStructure date(int year, int month, int day) {
        return new FeatureStructure(DerivedFeatures.STRUCTURE)
            .set("gregorian-year", FeatureValue.ofNumber(year))
            .set("gregorian-month", FeatureValue.ofNumber(month))
            .set("gregorian-day", FeatureValue.ofNumber(day));
    }

    private static FeatureStructure calendar(String feature, String value) {
        return new FeatureStructure(DerivedFeatures.STRUCTURE).set(feature, FeatureValue.ofString(value));
    }

    @Test
    void undeclaredFeatureIsDefault() {
        assertEquals(FeatureValue.defaultValue(), tracker.current(NUSACH));
        assertEquals(FeatureValue.undefined(), tracker.current(DerivedFeatures.HEBREW_DATE));
    }

    @Test
    void nestedDeclareRevertsOnEnd() {
        ScopeOwner outer = new ScopeOwner(1, "outer");
        ScopeOwner inner = new ScopeOwner(1, "inner");
        tracker.declare(outer, List.of(rite("nusach", FeatureValue.ofString("ashkenaz"))));
        tracker.declare(inner, List.of(rite("nusach", FeatureValue.ofString("sefard"))));
        assertEquals(FeatureValue.ofString("sefard"), tracker.current(NUSACH));

        tracker.endDeclare(inner);
        assertEquals(FeatureValue.ofString("ashkenaz"), tracker.current(NUSACH));
        tracker.endDeclare(outer);
        assertEquals(FeatureValue.defaultValue(), tracker.current(NUSACH));
        assertEquals(0, tracker.openDeclareCount());
    }

    @Test
    void crossingScopesEndInAnyOrder() {
        ScopeOwner a = new ScopeOwner(1, "a");
        ScopeOwner b = new ScopeOwner(1, "b");
        tracker.declare(a, List.of(rite("nusach", FeatureValue.ofString("ashkenaz"))));
        tracker.declare(b, List.of(rite("nusach", FeatureValue.ofString("sefard")),
            rite("mourner", FeatureValue.ofBoolean(true))));

        // a ends first although b opened later
        tracker.endDeclare(a);
        assertEquals(FeatureValue.ofString("sefard"), tracker.current(NUSACH));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(MOURNER));

        tracker.endDeclare(b);
        assertEquals(FeatureValue.defaultValue(), tracker.current(NUSACH));
        assertEquals(FeatureValue.defaultValue(), tracker.current(MOURNER));
    }

    @Test
    void unknownOrRepeatedOwnersAreRejected() {
        ScopeOwner owner = new ScopeOwner(1, "d");
        assertThrows(UnbalancedScopeException.class, () -> tracker.endDeclare(owner));
        tracker.declare(owner, List.of(rite("nusach", FeatureValue.ofString("ashkenaz"))));
        assertThrows(UnbalancedScopeException.class,
            () -> tracker.declare(owner, List.of(rite("nusach", FeatureValue.ofString("sefard")))));
    }

    @Test
    void sameIdInAnotherVisitIsAnotherScope() {
        tracker.declare(new ScopeOwner(1, "d"), List.of(rite("nusach", FeatureValue.ofString("ashkenaz"))));
        tracker.declare(new ScopeOwner(2, "d"), List.of(rite("nusach", FeatureValue.ofString("sefard"))));
        assertEquals(List.of("d"), tracker.endVisit(2));
        assertEquals(FeatureValue.ofString("ashkenaz"), tracker.current(NUSACH));
        assertTrue(tracker.isOpen(new ScopeOwner(1, "d")));
    }

    @Test
    void gregorianDateDerivesHebrewDateAndWeekday() {
        tracker.declare(new ScopeOwner(1, "date"), List.of(date(2025, 9, 23)));
        assertEquals(FeatureValue.ofString("5786-07-01"), tracker.current(DerivedFeatures.HEBREW_DATE));
        assertEquals(FeatureValue.ofString("tuesday"), tracker.current(DerivedFeatures.DAY_OF_WEEK));
        // no location yet, so nothing that depends on it is known
        assertEquals(FeatureValue.undefined(), tracker.current(DerivedFeatures.HOLIDAY));

        tracker.declare(new ScopeOwner(1, "place"), List.of(calendar("location", "jerusalem")));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(DerivedFeatures.ISRAEL));
        assertEquals(FeatureValue.ofString(HolidayRules.ROSH_HASHANAH), tracker.current(DerivedFeatures.HOLIDAY));
    }

    @Test
    void israelComesFromTheLocation() {
        tracker.declare(new ScopeOwner(1, "place"), List.of(calendar("location", " Israel ")));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(DerivedFeatures.ISRAEL));
        tracker.declare(new ScopeOwner(1, "city"), List.of(calendar("location", "Safed")));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(DerivedFeatures.ISRAEL));
        tracker.declare(new ScopeOwner(1, "abroad"), List.of(calendar("location", "new-york")));
        assertEquals(FeatureValue.ofBoolean(false), tracker.current(DerivedFeatures.ISRAEL));

        tracker.endDeclare(new ScopeOwner(1, "abroad"));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(DerivedFeatures.ISRAEL));
    }

    @Test
    void derivedFeaturesFollowInputChanges() {
        tracker.declare(new ScopeOwner(1, "place"), List.of(calendar("location", "diaspora")));
        tracker.declare(new ScopeOwner(1, "date"), List.of(date(2024, 4, 30)));
        assertEquals(FeatureValue.ofString(HolidayRules.PESACH), tracker.current(DerivedFeatures.HOLIDAY));

        tracker.declare(new ScopeOwner(1, "moved"), List.of(calendar("location", "israel")));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(DerivedFeatures.ISRAEL));
        assertEquals(FeatureValue.ofString(HolidayRules.NONE), tracker.current(DerivedFeatures.HOLIDAY));

        tracker.endDeclare(new ScopeOwner(1, "moved"));
        assertEquals(FeatureValue.ofString(HolidayRules.PESACH), tracker.current(DerivedFeatures.HOLIDAY));

        tracker.endDeclare(new ScopeOwner(1, "date"));
        assertEquals(FeatureValue.undefined(), tracker.current(DerivedFeatures.HEBREW_DATE));
        assertEquals(FeatureValue.undefined(), tracker.current(DerivedFeatures.HOLIDAY));
    }

    @Test
    void explicitDeclarationOverridesDerivedValue() {
        tracker.declare(new ScopeOwner(1, "date"), List.of(date(2025, 9, 23)));
        ScopeOwner override = new ScopeOwner(1, "override");
        tracker.declare(override, List.of(calendar("day-of-week", "saturday")));
        assertEquals(FeatureValue.ofString("saturday"), tracker.current(DerivedFeatures.DAY_OF_WEEK));
        tracker.endDeclare(override);
        assertEquals(FeatureValue.ofString("tuesday"), tracker.current(DerivedFeatures.DAY_OF_WEEK));
    }

    @Test
    void torahReadingOnMondayMorningButNotTuesday() {
        tracker.declare(new ScopeOwner(1, "setup"), List.of(
            calendar("location", "diaspora"), calendar("time-of-day", "morning")));

        ScopeOwner monday = new ScopeOwner(1, "monday");
        tracker.declare(monday, List.of(date(2025, 6, 2)));
        assertEquals(FeatureValue.ofString(DerivedFeatures.SHACHARIT), tracker.current(DerivedFeatures.SERVICE_TIME));
        assertEquals(FeatureValue.ofBoolean(true), tracker.current(DerivedFeatures.TORAH_READING));
        tracker.endDeclare(monday);

        tracker.declare(new ScopeOwner(1, "tuesday"), List.of(date(2024, 1, 2)));
        assertEquals(FeatureValue.ofString(HolidayRules.NONE), tracker.current(DerivedFeatures.HOLIDAY));
        assertEquals(FeatureValue.ofBoolean(false), tracker.current(DerivedFeatures.TORAH_READING));
    }

    @Test
    void invalidGregorianDateIsUndefined() {
        tracker.declare(new ScopeOwner(1, "date"), List.of(date(2025, 2, 30)));
        assertEquals(FeatureValue.undefined(), tracker.current(DerivedFeatures.HEBREW_DATE));
    }

    @Test
    void snapshotListsDeclaredAndDerivedValues() {
        tracker.declare(new ScopeOwner(1, "d"), List.of(rite("nusach", FeatureValue.ofString("ashkenaz"))));
        assertEquals(FeatureValue.ofString("ashkenaz"), tracker.snapshot().get(NUSACH));
        assertTrue(tracker.snapshot().containsKey(DerivedFeatures.TORAH_READING));
    }
}
