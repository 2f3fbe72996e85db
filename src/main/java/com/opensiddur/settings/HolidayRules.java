package com.opensiddur.settings;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed rules naming the holidays and observances of a Hebrew date, including the
 * extra diaspora festival days and the postponement of fasts that fall on Shabbat.
 */
public final class HolidayRules {
    public static final String NONE = "none";

    public static final String ROSH_HASHANAH = "rosh-hashanah";
    public static final String TZOM_GEDALIAH = "tzom-gedaliah";
    public static final String YOM_KIPPUR = "yom-kippur";
    public static final String SUKKOT = "sukkot";
    public static final String CHOL_HAMOED_SUKKOT = "chol-hamoed-sukkot";
    public static final String HOSHANA_RABBAH = "hoshana-rabbah";
    public static final String SHEMINI_ATZERET = "shemini-atzeret";
    public static final String SIMCHAT_TORAH = "simchat-torah";
    public static final String CHANUKAH = "chanukah";
    public static final String ASARAH_BETEVET = "asarah-betevet";
    public static final String TU_BISHVAT = "tu-bishvat";
    public static final String TAANIT_ESTHER = "taanit-esther";
    public static final String PURIM = "purim";
    public static final String SHUSHAN_PURIM = "shushan-purim";
    public static final String PESACH = "pesach";
    public static final String CHOL_HAMOED_PESACH = "chol-hamoed-pesach";
    public static final String SHAVUOT = "shavuot";
    public static final String SHIVA_ASAR_BETAMMUZ = "shiva-asar-betammuz";
    public static final String TISHA_BAV = "tisha-bav";
    public static final String ROSH_CHODESH = "rosh-chodesh";

    public static final String YOM_TOV = "yom-tov";
    public static final String CHOL_HAMOED = "chol-hamoed";
    public static final String FAST_DAY = "fast-day";
    public static final String SHABBAT = "shabbat";

    private static final Set<String> YAMIM_TOVIM = Set.of(
        ROSH_HASHANAH, YOM_KIPPUR, SUKKOT, SHEMINI_ATZERET, SIMCHAT_TORAH, PESACH, SHAVUOT);
    private static final Set<String> FASTS = Set.of(
        TZOM_GEDALIAH, YOM_KIPPUR, ASARAH_BETEVET, TAANIT_ESTHER, SHIVA_ASAR_BETAMMUZ, TISHA_BAV);
    private static final Set<String> CHOL_HAMOED_DAYS = Set.of(CHOL_HAMOED_SUKKOT, CHOL_HAMOED_PESACH);

    private HolidayRules() {}

    /**
     * Observances of the day, most significant first. Empty on an ordinary day.
     *
     * @param dayOfWeek 0 = Sunday .. 6 = Shabbat
     */
    public static List<String> holidays(HebrewDate date, boolean israel, int dayOfWeek) {
        List<String> names = new ArrayList<>();
        int m = date.getMonth();
        int d = date.getDay();
        int year = date.getYear();
        int purimMonth = HebrewCalendar.isLeapYear(year) ? HebrewDate.ADAR_II : HebrewDate.ADAR;

        if (m == HebrewDate.TISHREI) {
            if (d == 1 || d == 2) names.add(ROSH_HASHANAH);
            if ((d == 3 && dayOfWeek != 6) || (d == 4 && dayOfWeek == 0)) names.add(TZOM_GEDALIAH);
            if (d == 10) names.add(YOM_KIPPUR);
            if (d == 15 || (d == 16 && !israel)) names.add(SUKKOT);
            if ((d == 16 && israel) || (d >= 17 && d <= 20)) names.add(CHOL_HAMOED_SUKKOT);
            if (d == 21) names.add(HOSHANA_RABBAH);
            if (d == 22) names.add(SHEMINI_ATZERET);
            if ((d == 22 && israel) || (d == 23 && !israel)) names.add(SIMCHAT_TORAH);
        }
        long chanukahStart = HebrewCalendar.toFixed(year, HebrewDate.KISLEV, 25);
        long today = HebrewCalendar.toFixed(year, m, d);
        if (today - chanukahStart >= 0 && today - chanukahStart <= 7) {
            names.add(CHANUKAH);
        }
        if (m == HebrewDate.TEVET && d == 10) names.add(ASARAH_BETEVET);
        if (m == HebrewDate.SHEVAT && d == 15) names.add(TU_BISHVAT);
        if (m == purimMonth) {
            // the fast moves back to Thursday when the 13th is Shabbat
            if ((d == 13 && dayOfWeek != 6) || (d == 11 && dayOfWeek == 4)) names.add(TAANIT_ESTHER);
            if (d == 14) names.add(PURIM);
            if (d == 15) names.add(SHUSHAN_PURIM);
        }
        if (m == HebrewDate.NISAN) {
            if (d == 15 || d == 21 || (!israel && (d == 16 || d == 22))) names.add(PESACH);
            if ((d == 16 && israel) || (d >= 17 && d <= 20)) names.add(CHOL_HAMOED_PESACH);
        }
        if (m == HebrewDate.SIVAN && (d == 6 || (d == 7 && !israel))) names.add(SHAVUOT);
        if (m == HebrewDate.TAMMUZ && ((d == 17 && dayOfWeek != 6) || (d == 18 && dayOfWeek == 0))) {
            names.add(SHIVA_ASAR_BETAMMUZ);
        }
        if (m == HebrewDate.AV && ((d == 9 && dayOfWeek != 6) || (d == 10 && dayOfWeek == 0))) {
            names.add(TISHA_BAV);
        }
        if ((d == 1 && m != HebrewDate.TISHREI) || d == 30) {
            names.add(ROSH_CHODESH);
        }
        return names;
    }

    /**
     * Primary holiday name, or {@link #NONE}.
     */
    public static String primary(List<String> holidays) {
        return holidays.isEmpty() ? NONE : holidays.get(0);
    }

    /**
     * Every holiday name plus the categories it belongs to (yom-tov, chol-hamoed, fast-day)
     * and shabbat when the day is Shabbat.
     */
    public static Set<String> aggregate(List<String> holidays, int dayOfWeek) {
        Set<String> aggregate = new LinkedHashSet<>(holidays);
        for (String name : holidays) {
            if (YAMIM_TOVIM.contains(name)) aggregate.add(YOM_TOV);
            if (FASTS.contains(name)) aggregate.add(FAST_DAY);
            if (CHOL_HAMOED_DAYS.contains(name) || HOSHANA_RABBAH.equals(name)) aggregate.add(CHOL_HAMOED);
        }
        if (dayOfWeek == 6) {
            aggregate.add(SHABBAT);
        }
        return aggregate;
    }

    /**
     * Whether the Torah is read at the given service.
     */
    public static boolean torahReading(String serviceTime, int dayOfWeek, Set<String> aggregate) {
        if (DerivedFeatures.SHACHARIT.equals(serviceTime)) {
            return dayOfWeek == 1 || dayOfWeek == 4 || dayOfWeek == 6
                || aggregate.contains(YOM_TOV) || aggregate.contains(CHOL_HAMOED)
                || aggregate.contains(ROSH_CHODESH) || aggregate.contains(CHANUKAH)
                || aggregate.contains(PURIM) || aggregate.contains(FAST_DAY);
        }
        if (DerivedFeatures.MINCHA.equals(serviceTime)) {
            return dayOfWeek == 6 || aggregate.contains(FAST_DAY);
        }
        return false;
    }
}
