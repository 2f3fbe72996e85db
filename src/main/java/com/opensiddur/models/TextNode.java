package com.opensiddur.models;

public class TextNode extends Node {
    private String text;

    public TextNode() {}

    public TextNode(String text) {
        this.text = text;
    }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    @Override
    public String pathName() {
        return "text()";
    }

    @Override
    public TextNode copy() {
        return new TextNode(text);
    }
}
