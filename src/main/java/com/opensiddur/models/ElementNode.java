package com.opensiddur.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ElementNode extends Node {
    public static final String ATTR_CORRESP = "corresp";
    public static final String ATTR_ID = "xml:id";
    public static final String ATTR_LANG = "xml:lang";
    public static final String ATTR_TYPE = "type";
    public static final String ATTR_TARGET = "target";
    public static final String ATTR_TARGET_END = "targetEnd";

    private String tag;
    private Map<String, String> attributes = new LinkedHashMap<>();
    private List<Node> children = new ArrayList<>();

    public ElementNode() {}

    public ElementNode(String tag) {
        this.tag = tag;
    }

    public ElementNode(String tag, Map<String, String> attributes, List<Node> children) {
        this.tag = tag;
        setAttributes(attributes);
        setChildren(children);
    }

    public String getTag() { return tag; }
    public void setTag(String tag) { this.tag = tag; }

    public Map<String, String> getAttributes() { return attributes; }
    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
    }

    public List<Node> getChildren() { return children; }
    public void setChildren(List<Node> children) {
        this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public ElementNode attribute(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public ElementNode add(Node child) {
        children.add(child);
        return this;
    }

    /**
     * Tag without any namespace prefix ("tei:p" -> "p").
     */
    public String localName() {
        if (tag == null) return "";
        int colon = tag.indexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }

    /**
     * Same tag and attributes, no children.
     */
    public ElementNode shallowCopy() {
        return new ElementNode(tag, attributes, null);
    }

    @Override
    public String pathName() {
        return localName();
    }

    @Override
    public ElementNode copy() {
        ElementNode copy = shallowCopy();
        for (Node child : children) {
            copy.add(child.copy());
        }
        return copy;
    }
}
