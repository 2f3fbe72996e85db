package com.opensiddur.models;

public class EndConditional extends Node {
    private String target;

    public EndConditional() {}

    public EndConditional(String target) {
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
        return "endConditional";
    }

    @Override
    public EndConditional copy() {
        return new EndConditional(target);
    }
}
