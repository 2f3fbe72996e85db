package com.opensiddur.models;

public class EndDeclare extends Node {
    private String target;

    public EndDeclare() {}

    public EndDeclare(String target) {
        this.target = target;
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    @Override
    public boolean isScaffolding() {
        return true;
    }

    @Override
    public String pathName() {
        return "endDeclare";
    }

    @Override
    public EndDeclare copy() {
        return new EndDeclare(target);
    }
}
