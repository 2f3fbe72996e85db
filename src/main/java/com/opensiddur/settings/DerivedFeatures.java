package com.opensiddur.settings;

import com.opensiddur.conditions.FeatureLookup;
import com.opensiddur.models.FeatureKey;
import com.opensiddur.models.FeatureValue;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The calendar features of the {@code opensiddur:calendar} structure.
 *
 * Inputs (declared by documents):
 *   gregorian-year, gregorian-month, gregorian-day   numeric
 *   location                                         string; an Israeli place (see ISRAELI_LOCATIONS)
 *                                                    or anything else, which counts as the diaspora
 *   time-of-day                                      string: morning, afternoon, evening, night
 *
 * Derived (recomputed whenever an input changes):
 *   hebrew-date        "yyyy-mm-dd", Nisan = 1
 *   day-of-week        sunday .. saturday
 *   israel             boolean
 *   holiday            primary observance or "none"
 *   holiday-aggregate  alternation of every observance and category
 *   service-time       shacharit, mincha, maariv
 *   torah-reading      boolean
 */
public final class DerivedFeatures {
    public static final String STRUCTURE = "opensiddur:calendar";

    public static final FeatureKey GREGORIAN_YEAR = key("gregorian-year");
    public static final FeatureKey GREGORIAN_MONTH = key("gregorian-month");
    public static final FeatureKey GREGORIAN_DAY = key("gregorian-day");
    public static final FeatureKey LOCATION = key("location");
    public static final FeatureKey TIME_OF_DAY = key("time-of-day");

    public static final FeatureKey HEBREW_DATE = key("hebrew-date");
    public static final FeatureKey DAY_OF_WEEK = key("day-of-week");
    public static final FeatureKey ISRAEL = key("israel");

    /** Location values, lower case, that observe the Israeli calendar. */
    public static final Set<String> ISRAELI_LOCATIONS = Set.of(
        "israel", "eretz-yisrael", "jerusalem", "tel-aviv", "haifa", "safed", "tiberias", "beersheba");
    public static final FeatureKey HOLIDAY = key("holiday");
    public static final FeatureKey HOLIDAY_AGGREGATE = key("holiday-aggregate");
    public static final FeatureKey SERVICE_TIME = key("service-time");
    public static final FeatureKey TORAH_READING = key("torah-reading");

    public static final String SHACHARIT = "shacharit";
    public static final String MINCHA = "mincha";
    public static final String MAARIV = "maariv";

    public static final List<String> DAY_NAMES = List.of(
        "sunday", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday");

    private static final List<FeatureKey> GREGORIAN = List.of(GREGORIAN_YEAR, GREGORIAN_MONTH, GREGORIAN_DAY);

    private DerivedFeatures() {}

    private static FeatureKey key(String feature) {
        return FeatureKey.of(STRUCTURE, feature);
    }

    /**
     * Every derived feature, each listed after the features it reads.
     */
    public static List<DerivedFeature> all() {
        List<DerivedFeature> features = new ArrayList<>();
        features.add(new DerivedFeature(HEBREW_DATE, GREGORIAN, lookup -> {
            LocalDate date = gregorian(lookup);
            return date != null ? FeatureValue.ofString(HebrewCalendar.fromGregorian(date).toString()) : null;
        }));
        features.add(new DerivedFeature(DAY_OF_WEEK, GREGORIAN, lookup -> {
            LocalDate date = gregorian(lookup);
            return date != null ? FeatureValue.ofString(DAY_NAMES.get(dayIndex(date))) : null;
        }));
        features.add(new DerivedFeature(ISRAEL, List.of(LOCATION), lookup -> {
            FeatureValue location = lookup.current(LOCATION);
            if (location.getKind() != FeatureValue.Kind.STRING) {
                return null;
            }
            return FeatureValue.ofBoolean(ISRAELI_LOCATIONS.contains(location.getString().trim().toLowerCase(Locale.ROOT)));
        }));
        features.add(new DerivedFeature(HOLIDAY, List.of(HEBREW_DATE, ISRAEL, DAY_OF_WEEK), lookup -> {
            List<String> holidays = holidays(lookup);
            return holidays != null ? FeatureValue.ofString(HolidayRules.primary(holidays)) : null;
        }));
        features.add(new DerivedFeature(HOLIDAY_AGGREGATE, List.of(HEBREW_DATE, ISRAEL, DAY_OF_WEEK), lookup -> {
            List<String> holidays = holidays(lookup);
            if (holidays == null) {
                return null;
            }
            Set<String> aggregate = HolidayRules.aggregate(holidays, dayIndex(lookup.current(DAY_OF_WEEK)));
            return FeatureValue.alternationOf(aggregate.toArray(new String[0]));
        }));
        features.add(new DerivedFeature(SERVICE_TIME, List.of(TIME_OF_DAY), lookup -> {
            FeatureValue time = lookup.current(TIME_OF_DAY);
            if (time.getKind() != FeatureValue.Kind.STRING) {
                return null;
            }
            switch (time.getString().trim().toLowerCase(Locale.ROOT)) {
                case "morning":
                    return FeatureValue.ofString(SHACHARIT);
                case "afternoon":
                    return FeatureValue.ofString(MINCHA);
                case "evening":
                case "night":
                    return FeatureValue.ofString(MAARIV);
                default:
                    return null;
            }
        }));
        features.add(new DerivedFeature(TORAH_READING, List.of(SERVICE_TIME, DAY_OF_WEEK, HOLIDAY_AGGREGATE), lookup -> {
            int day = dayIndex(lookup.current(DAY_OF_WEEK));
            if (day < 0) {
                return null;
            }
            List<String> members = new ArrayList<>();
            FeatureValue aggregate = lookup.current(HOLIDAY_AGGREGATE);
            if (aggregate.getAlternatives() != null) {
                for (FeatureValue member : aggregate.getAlternatives()) {
                    members.add(member.getString());
                }
            }
            return FeatureValue.ofBoolean(HolidayRules.torahReading(
                lookup.current(SERVICE_TIME).getString(), day, Set.copyOf(members)));
        }));
        return features;
    }

    private static LocalDate gregorian(FeatureLookup lookup) {
        for (FeatureKey key : GREGORIAN) {
            if (lookup.current(key).getKind() != FeatureValue.Kind.NUMERIC || lookup.current(key).isRange()) {
                return null;
            }
        }
        try {
            return LocalDate.of(lookup.current(GREGORIAN_YEAR).intValue(),
                lookup.current(GREGORIAN_MONTH).intValue(),
                lookup.current(GREGORIAN_DAY).intValue());
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static List<String> holidays(FeatureLookup lookup) {
        FeatureValue hebrew = lookup.current(HEBREW_DATE);
        FeatureValue israel = lookup.current(ISRAEL);
        int day = dayIndex(lookup.current(DAY_OF_WEEK));
        if (hebrew.getKind() != FeatureValue.Kind.STRING || israel.getKind() != FeatureValue.Kind.BOOLEAN || day < 0) {
            return null;
        }
        HebrewDate date;
        try {
            date = HebrewDate.parse(hebrew.getString());
        } catch (IllegalArgumentException e) {
            return null;
        }
        return HolidayRules.holidays(date, israel.getBool(), day);
    }

    /**
     * 0 = Sunday .. 6 = Saturday.
     */
    static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    private static int dayIndex(FeatureValue dayName) {
        if (dayName.getKind() != FeatureValue.Kind.STRING) {
            return -1;
        }
        return DAY_NAMES.indexOf(dayName.getString().trim().toLowerCase(Locale.ROOT));
    }

    public static boolean isDerived(FeatureKey key) {
        return Arrays.asList(HEBREW_DATE, DAY_OF_WEEK, ISRAEL, HOLIDAY, HOLIDAY_AGGREGATE, SERVICE_TIME, TORAH_READING)
            .contains(key);
    }
}
