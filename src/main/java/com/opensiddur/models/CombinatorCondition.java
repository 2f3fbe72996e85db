package com.opensiddur.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public abstract class CombinatorCondition extends Condition {

    public enum Operator { ALL, ANY, NONE, ONE }

    private List<Condition> conditions = new ArrayList<>();

    protected CombinatorCondition() {}

    protected CombinatorCondition(List<Condition> conditions) {
        setConditions(conditions);
    }

    public List<Condition> getConditions() { return conditions; }
    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    public abstract Operator operator();

    public static CombinatorCondition all(Condition... conditions) {
        return new All(Arrays.asList(conditions));
    }

    public static CombinatorCondition any(Condition... conditions) {
        return new Any(Arrays.asList(conditions));
    }

    public static CombinatorCondition none(Condition... conditions) {
        return new None(Arrays.asList(conditions));
    }

    public static CombinatorCondition one(Condition... conditions) {
        return new One(Arrays.asList(conditions));
    }

    public static class All extends CombinatorCondition {
        public All() {}
        public All(List<Condition> conditions) { super(conditions); }

        @Override
        public Operator operator() { return Operator.ALL; }
    }

    public static class Any extends CombinatorCondition {
        public Any() {}
        public Any(List<Condition> conditions) { super(conditions); }

        @Override
        public Operator operator() { return Operator.ANY; }
    }

    public static class None extends CombinatorCondition {
        public None() {}
        public None(List<Condition> conditions) { super(conditions); }

        @Override
        public Operator operator() { return Operator.NONE; }
    }

    public static class One extends CombinatorCondition {
        public One() {}
        public One(List<Condition> conditions) { super(conditions); }

        @Override
        public Operator operator() { return Operator.ONE; }
    }
}
