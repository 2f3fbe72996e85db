package com.opensiddur.settings;

import java.time.LocalDate;

/**
 * Fixed arithmetic of the Hebrew calendar (molad and postponement rules),
 * counted in fixed day numbers where day 1 is 1 January of year 1 (proleptic Gregorian).
 */
public final class HebrewCalendar {

    /** Fixed day number of 1 Tishrei AM 1. */
    static final long EPOCH = -1373427L;

    /** Fixed day number of 1970-01-01. */
    private static final long UNIX_EPOCH_FIXED = 719163L;

    private HebrewCalendar() {}

    public static long fixedFromGregorian(LocalDate date) {
        return date.toEpochDay() + UNIX_EPOCH_FIXED;
    }

    public static LocalDate gregorianFromFixed(long fixed) {
        return LocalDate.ofEpochDay(fixed - UNIX_EPOCH_FIXED);
    }

    public static HebrewDate fromGregorian(LocalDate date) {
        return fromFixed(fixedFromGregorian(date));
    }

    public static LocalDate toGregorian(HebrewDate date) {
        return gregorianFromFixed(toFixed(date.getYear(), date.getMonth(), date.getDay()));
    }

    public static boolean isLeapYear(int year) {
        return Math.floorMod(7L * year + 1, 19) < 7;
    }

    public static int lastMonthOfYear(int year) {
        return isLeapYear(year) ? HebrewDate.ADAR_II : HebrewDate.ADAR;
    }

    static long elapsedDays(int year) {
        long monthsElapsed = Math.floorDiv(235L * year - 234, 19);
        long partsElapsed = 12084 + 13753 * monthsElapsed;
        long days = 29 * monthsElapsed + Math.floorDiv(partsElapsed, 25920);
        return Math.floorMod(3 * (days + 1), 7) < 3 ? days + 1 : days;
    }

    private static int yearLengthCorrection(int year) {
        long ny0 = elapsedDays(year - 1);
        long ny1 = elapsedDays(year);
        long ny2 = elapsedDays(year + 1);
        if (ny2 - ny1 == 356) {
            return 2;
        }
        if (ny1 - ny0 == 382) {
            return 1;
        }
        return 0;
    }

    public static long newYear(int year) {
        return EPOCH + elapsedDays(year) + yearLengthCorrection(year);
    }

    public static int daysInYear(int year) {
        return (int) (newYear(year + 1) - newYear(year));
    }

    static boolean longMarheshvan(int year) {
        int days = daysInYear(year);
        return days == 355 || days == 385;
    }

    static boolean shortKislev(int year) {
        int days = daysInYear(year);
        return days == 353 || days == 383;
    }

    public static int daysInMonth(int year, int month) {
        switch (month) {
            case HebrewDate.IYYAR:
            case HebrewDate.TAMMUZ:
            case HebrewDate.ELUL:
            case HebrewDate.TEVET:
            case HebrewDate.ADAR_II:
                return 29;
            case HebrewDate.ADAR:
                return isLeapYear(year) ? 30 : 29;
            case HebrewDate.MARHESHVAN:
                return longMarheshvan(year) ? 30 : 29;
            case HebrewDate.KISLEV:
                return shortKislev(year) ? 29 : 30;
            default:
                return 30;
        }
    }

    public static long toFixed(int year, int month, int day) {
        long fixed = newYear(year) + day - 1;
        if (month < HebrewDate.TISHREI) {
            for (int m = HebrewDate.TISHREI; m <= lastMonthOfYear(year); m++) {
                fixed += daysInMonth(year, m);
            }
            for (int m = HebrewDate.NISAN; m < month; m++) {
                fixed += daysInMonth(year, m);
            }
        } else {
            for (int m = HebrewDate.TISHREI; m < month; m++) {
                fixed += daysInMonth(year, m);
            }
        }
        return fixed;
    }

    public static HebrewDate fromFixed(long fixed) {
        // 35975351 / 98496 days is the mean Hebrew year
        long approx = Math.floorDiv((fixed - EPOCH) * 98496L, 35975351L) + 1;
        int year = (int) approx - 1;
        while (newYear(year + 1) <= fixed) {
            year++;
        }
        int month = fixed < toFixed(year, HebrewDate.NISAN, 1) ? HebrewDate.TISHREI : HebrewDate.NISAN;
        while (fixed > toFixed(year, month, daysInMonth(year, month))) {
            month++;
        }
        int day = (int) (fixed - toFixed(year, month, 1)) + 1;
        return new HebrewDate(year, month, day);
    }
}
