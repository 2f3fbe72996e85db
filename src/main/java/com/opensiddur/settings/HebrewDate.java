package com.opensiddur.settings;

import java.util.Objects;

/**
 * Date in the Hebrew calendar. Months are numbered from Nisan (1) to Adar (12) or Adar II (13);
 * the year begins with Tishrei (7).
 */
public final class HebrewDate {
    public static final int NISAN = 1;
    public static final int IYYAR = 2;
    public static final int SIVAN = 3;
    public static final int TAMMUZ = 4;
    public static final int AV = 5;
    public static final int ELUL = 6;
    public static final int TISHREI = 7;
    public static final int MARHESHVAN = 8;
    public static final int KISLEV = 9;
    public static final int TEVET = 10;
    public static final int SHEVAT = 11;
    public static final int ADAR = 12;
    public static final int ADAR_II = 13;

    private static final String[] MONTH_NAMES = {
        "", "Nisan", "Iyyar", "Sivan", "Tammuz", "Av", "Elul",
        "Tishrei", "Marheshvan", "Kislev", "Tevet", "Shevat", "Adar", "Adar II"
    };

    private final int year;
    private final int month;
    private final int day;

    public HebrewDate(int year, int month, int day) {
        if (month < NISAN || month > ADAR_II || day < 1 || day > 30) {
            throw new IllegalArgumentException("Invalid Hebrew date " + year + "-" + month + "-" + day);
        }
        this.year = year;
        this.month = month;
        this.day = day;
    }

    /**
     * Parse the "yyyy-mm-dd" form produced by {@link #toString()}.
     */
    public static HebrewDate parse(String value) {
        String[] parts = value != null ? value.split("-") : new String[0];
        if (parts.length != 3) {
            throw new IllegalArgumentException("Not a Hebrew date: " + value);
        }
        try {
            return new HebrewDate(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a Hebrew date: " + value, e);
        }
    }

    public int getYear() { return year; }
    public int getMonth() { return month; }
    public int getDay() { return day; }

    public String monthName() {
        if (month == ADAR && HebrewCalendar.isLeapYear(year)) {
            return "Adar I";
        }
        return MONTH_NAMES[month];
    }

    public String display() {
        return day + " " + monthName() + " " + year;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HebrewDate)) return false;
        HebrewDate that = (HebrewDate) o;
        return year == that.year && month == that.month && day == that.day;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d-%02d", year, month, day);
    }
}
