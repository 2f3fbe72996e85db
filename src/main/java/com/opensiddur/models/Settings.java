package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Compile settings:
 * <pre>
 * priority:
 *   transclusion: [wlc, jps1917]   # which project wins an unqualified reference
 *   instructions: [jps1917]        # which project's instruction notes are used
 * annotations: [commentary]        # projects whose standoff notes are merged
 * </pre>
 * A value is passed explicitly through a compile and never shared between compiles.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Settings {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Priority {
        private List<String> transclusion = new ArrayList<>();
        private List<String> instructions = new ArrayList<>();

        public Priority() {}

        public Priority(List<String> transclusion, List<String> instructions) {
            setTransclusion(transclusion);
            setInstructions(instructions);
        }

        public List<String> getTransclusion() { return transclusion; }
        public void setTransclusion(List<String> transclusion) {
            this.transclusion = transclusion != null ? new ArrayList<>(transclusion) : new ArrayList<>();
        }

        public List<String> getInstructions() { return instructions; }
        public void setInstructions(List<String> instructions) {
            this.instructions = instructions != null ? new ArrayList<>(instructions) : new ArrayList<>();
        }
    }

    private Priority priority = new Priority();
    private List<String> annotations = new ArrayList<>();

    public Settings() {}

    public Settings(List<String> transclusion, List<String> instructions, List<String> annotations) {
        this.priority = new Priority(transclusion, instructions);
        setAnnotations(annotations);
    }

    public static Settings empty() {
        return new Settings();
    }

    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority != null ? priority : new Priority(); }

    public List<String> getAnnotations() { return annotations; }
    public void setAnnotations(List<String> annotations) {
        this.annotations = annotations != null ? new ArrayList<>(annotations) : new ArrayList<>();
    }

    public List<String> transclusionPriority() {
        return Collections.unmodifiableList(priority.getTransclusion());
    }

    public List<String> instructionsPriority() {
        return Collections.unmodifiableList(priority.getInstructions());
    }

    /**
     * Annotation projects without duplicates, in the order given.
     */
    public List<String> annotationProjects() {
        return List.copyOf(new LinkedHashSet<>(annotations));
    }

    /**
     * Fill unset values for a compile starting in {@code nativeProject}: transclusion priority
     * defaults to that project; instruction priority and annotations stay empty, which keeps
     * the native instruction notes and adds no commentary.
     */
    public Settings withDefaults(String nativeProject) {
        List<String> transclusion = priority.getTransclusion();
        if (transclusion.isEmpty() && nativeProject != null) {
            transclusion = List.of(nativeProject);
        }
        return new Settings(transclusion, priority.getInstructions(), annotations);
    }
}
