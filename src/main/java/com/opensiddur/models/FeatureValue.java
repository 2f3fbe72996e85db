package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Value of a single feature: boolean, numeric (optionally an inclusive range up to {@code max}),
 * string, alternation of values, negation of a value, or one of the two unset markers.
 * UNDEFINED means "known to be unknown"; DEFAULT means "never declared".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureValue {

    public enum Kind {
        BOOLEAN("boolean"),
        NUMERIC("numeric"),
        STRING("string"),
        ALTERNATION("alternation"),
        NEGATION("negation"),
        UNDEFINED("undefined"),
        DEFAULT("default");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private static final FeatureValue UNDEFINED = new FeatureValue(Kind.UNDEFINED);
    private static final FeatureValue DEFAULT = new FeatureValue(Kind.DEFAULT);

    private Kind kind;
    private Boolean bool;
    private Double number;
    private Double max;
    private String string;
    private List<FeatureValue> alternatives;
    private FeatureValue negated;

    public FeatureValue() {}

    private FeatureValue(Kind kind) {
        this.kind = kind;
    }

    public static FeatureValue ofBoolean(boolean value) {
        FeatureValue v = new FeatureValue(Kind.BOOLEAN);
        v.bool = value;
        return v;
    }

    public static FeatureValue ofNumber(double value) {
        FeatureValue v = new FeatureValue(Kind.NUMERIC);
        v.number = value;
        return v;
    }

    public static FeatureValue ofRange(double min, double max) {
        FeatureValue v = ofNumber(min);
        v.max = max;
        return v;
    }

    public static FeatureValue ofString(String value) {
        FeatureValue v = new FeatureValue(Kind.STRING);
        v.string = value;
        return v;
    }

    public static FeatureValue alternation(List<FeatureValue> alternatives) {
        FeatureValue v = new FeatureValue(Kind.ALTERNATION);
        v.alternatives = alternatives != null ? new ArrayList<>(alternatives) : new ArrayList<>();
        return v;
    }

    public static FeatureValue alternationOf(String... values) {
        List<FeatureValue> list = new ArrayList<>();
        for (String s : values) {
            list.add(ofString(s));
        }
        return alternation(list);
    }

    public static FeatureValue not(FeatureValue value) {
        FeatureValue v = new FeatureValue(Kind.NEGATION);
        v.negated = value;
        return v;
    }

    public static FeatureValue undefined() {
        return UNDEFINED;
    }

    public static FeatureValue defaultValue() {
        return DEFAULT;
    }

    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }

    public Boolean getBool() { return bool; }
    public void setBool(Boolean bool) { this.bool = bool; }

    public Double getNumber() { return number; }
    public void setNumber(Double number) { this.number = number; }

    public Double getMax() { return max; }
    public void setMax(Double max) { this.max = max; }

    public String getString() { return string; }
    public void setString(String string) { this.string = string; }

    public List<FeatureValue> getAlternatives() { return alternatives; }
    public void setAlternatives(List<FeatureValue> alternatives) { this.alternatives = alternatives; }

    public FeatureValue getNegated() { return negated; }
    public void setNegated(FeatureValue negated) { this.negated = negated; }

    /**
     * True for UNDEFINED and DEFAULT, the values that make any comparison undecidable.
     */
    @JsonIgnore
    public boolean isUnset() {
        return kind == null || kind == Kind.UNDEFINED || kind == Kind.DEFAULT;
    }

    @JsonIgnore
    public boolean isRange() {
        return kind == Kind.NUMERIC && max != null;
    }

    /**
     * Integer view of a numeric value, used by the calendar rules.
     */
    public int intValue() {
        if (kind != Kind.NUMERIC || number == null) {
            throw new IllegalStateException("Not a numeric value: " + this);
        }
        return (int) Math.round(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureValue)) return false;
        FeatureValue that = (FeatureValue) o;
        return kind == that.kind
            && Objects.equals(bool, that.bool)
            && Objects.equals(number, that.number)
            && Objects.equals(max, that.max)
            && Objects.equals(string, that.string)
            && Objects.equals(alternatives, that.alternatives)
            && Objects.equals(negated, that.negated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bool, number, max, string, alternatives, negated);
    }

    @Override
    public String toString() {
        if (kind == null) return "?";
        switch (kind) {
            case BOOLEAN:
                return String.valueOf(bool);
            case NUMERIC:
                return max != null ? number + ".." + max : String.valueOf(number);
            case STRING:
                return "\"" + string + "\"";
            case ALTERNATION:
                return "alt" + alternatives;
            case NEGATION:
                return "not(" + negated + ")";
            default:
                return kind.getValue();
        }
    }
}
