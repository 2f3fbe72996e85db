package com.opensiddur.models;

/**
 * Empty marker starting an addressable span. The span ends at the next milestone
 * of the same unit or at the end of the containing element.
 */
public class MilestoneNode extends Node {
    private String unit;
    private String n;
    private String corresp;

    public MilestoneNode() {}

    public MilestoneNode(String unit, String n, String corresp) {
        this.unit = unit;
        this.n = n;
        this.corresp = corresp;
    }

    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }

    public String getN() { return n; }
    public void setN(String n) { this.n = n; }

    public String getCorresp() { return corresp; }
    public void setCorresp(String corresp) { this.corresp = corresp; }

    @Override
    public String pathName() {
        return "milestone";
    }

    @Override
    public MilestoneNode copy() {
        return new MilestoneNode(unit, n, corresp);
    }
}
