package com.opensiddur.models;

import com.opensiddur.errors.CompileWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a compile: the resolved tree, the documents that contributed to it
 * (renderers collect licences and credits from them) and recoverable warnings.
 */
public class CompiledDocument {
    private String project;
    private String document;
    private long generation;
    private ElementNode root;
    private List<DocumentKey> sources = new ArrayList<>();
    private List<CompileWarning> warnings = new ArrayList<>();

    public CompiledDocument() {}

    public CompiledDocument(String project, String document, long generation, ElementNode root,
                            List<DocumentKey> sources, List<CompileWarning> warnings) {
        this.project = project;
        this.document = document;
        this.generation = generation;
        this.root = root;
        setSources(sources);
        setWarnings(warnings);
    }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public String getDocument() { return document; }
    public void setDocument(String document) { this.document = document; }

    public long getGeneration() { return generation; }
    public void setGeneration(long generation) { this.generation = generation; }

    public ElementNode getRoot() { return root; }
    public void setRoot(ElementNode root) { this.root = root; }

    public List<DocumentKey> getSources() { return sources; }
    public void setSources(List<DocumentKey> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    public List<CompileWarning> getWarnings() { return warnings; }
    public void setWarnings(List<CompileWarning> warnings) {
        this.warnings = warnings != null ? new ArrayList<>(warnings) : new ArrayList<>();
    }
}
