package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A source document as produced by the external loader. The compiler reads it and never modifies it.
 */
public class Document {
    private String project;
    private String path;
    private String lang;
    private ElementNode root;

    public Document() {}

    public Document(String project, String path, String lang, ElementNode root) {
        this.project = project;
        this.path = path;
        this.lang = lang;
        this.root = root;
    }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public String getLang() { return lang; }
    public void setLang(String lang) { this.lang = lang; }

    public ElementNode getRoot() { return root; }
    public void setRoot(ElementNode root) { this.root = root; }

    @JsonIgnore
    public DocumentKey getKey() {
        return new DocumentKey(project, path);
    }

    /**
     * Document language: the explicit value, else the root's xml:lang.
     */
    public String effectiveLang() {
        if (lang != null && !lang.isBlank()) {
            return lang;
        }
        return root != null ? root.attribute(ElementNode.ATTR_LANG) : null;
    }
}
