package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inclusion marker. {@code target} is a URN (optionally ranged or project-qualified)
 * or a same-document "#id" reference; {@code targetEnd} optionally names the range end separately.
 */
public class TransclusionRef extends Node {

    public enum Mode {
        INLINE("inline"),
        EXTERNAL("external");

        private final String value;

        Mode(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private String target;
    private String targetEnd;
    private Mode mode = Mode.EXTERNAL;

    public TransclusionRef() {}

    public TransclusionRef(String target, Mode mode) {
        this(target, null, mode);
    }

    public TransclusionRef(String target, String targetEnd, Mode mode) {
        this.target = target;
        this.targetEnd = targetEnd;
        this.mode = mode != null ? mode : Mode.EXTERNAL;
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public String getTargetEnd() { return targetEnd; }
    public void setTargetEnd(String targetEnd) { this.targetEnd = targetEnd; }

    public Mode getMode() { return mode; }
    public void setMode(Mode mode) { this.mode = mode != null ? mode : Mode.EXTERNAL; }

    @Override
    public boolean isScaffolding() {
        return true;
    }

    @Override
    public String pathName() {
        return "transclude";
    }

    @Override
    public TransclusionRef copy() {
        return new TransclusionRef(target, targetEnd, mode);
    }
}
