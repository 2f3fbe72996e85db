package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Empty marker denoting a single addressable point.
 * External anchors are targets of references from other documents and are never dropped.
 */
public class AnchorNode extends Node {

    public enum Type {
        INTERNAL("internal"),
        EXTERNAL("external");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private String id;
    private Type type = Type.INTERNAL;

    public AnchorNode() {}

    public AnchorNode(String id, Type type) {
        this.id = id;
        this.type = type != null ? type : Type.INTERNAL;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Type getType() { return type; }
    public void setType(Type type) { this.type = type != null ? type : Type.INTERNAL; }

    @JsonIgnore
    public boolean isExternal() {
        return type == Type.EXTERNAL;
    }

    @Override
    public String pathName() {
        return "anchor";
    }

    @Override
    public AnchorNode copy() {
        return new AnchorNode(id, type);
    }
}
