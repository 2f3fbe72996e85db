package com.opensiddur.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens a settings scope. The assignments stay in force until the {@link EndDeclare}
 * with the same id in the same document, independent of element nesting.
 */
public class DeclareBlock extends Node {
    private String id;
    private List<FeatureStructure> assignments = new ArrayList<>();

    public DeclareBlock() {}

    public DeclareBlock(String id, List<FeatureStructure> assignments) {
        this.id = id;
        setAssignments(assignments);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public List<FeatureStructure> getAssignments() { return assignments; }
    public void setAssignments(List<FeatureStructure> assignments) {
        this.assignments = assignments != null ? new ArrayList<>(assignments) : new ArrayList<>();
    }

    @Override
    public boolean isScaffolding() {
        return true;
    }

    @Override
    public String pathName() {
        return "declare";
    }

    @Override
    public DeclareBlock copy() {
        List<FeatureStructure> copies = new ArrayList<>();
        for (FeatureStructure fs : assignments) {
            copies.add(fs.copy());
        }
        return new DeclareBlock(id, copies);
    }
}
