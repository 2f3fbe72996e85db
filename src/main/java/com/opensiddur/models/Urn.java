package com.opensiddur.models;

import com.opensiddur.errors.MalformedRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed {@code urn:x-opensiddur:} reference.
 *
 * Syntax:
 *   urn:x-opensiddur:text:bible:genesis/1/1          -> single passage
 *   urn:x-opensiddur:text:bible:genesis/1/1-3        -> range, end replaces the last component
 *   urn:x-opensiddur:text:bible:genesis/1/1-2/3      -> range, end replaces the last two components
 *   urn:x-opensiddur:text:bible:genesis/1/1@wlc      -> qualified by project
 *
 * The name part after the type ("bible:genesis") is the first path segment; every
 * slash component adds one level of depth. Dashes in the name part are never ranges.
 */
public final class Urn {
    private static final String SCHEME = "urn";

    private final String namespace;
    private final String type;
    private final List<String> path;
    private final List<String> endPath;
    private final String project;

    private Urn(String namespace, String type, List<String> path, List<String> endPath, String project) {
        this.namespace = namespace;
        this.type = type;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.endPath = endPath != null ? Collections.unmodifiableList(new ArrayList<>(endPath)) : null;
        this.project = project;
    }

    public static boolean isUrn(String value) {
        return value != null && value.startsWith(SCHEME + ":");
    }

    /**
     * @throws IllegalArgumentException if the value is not a URN
     * @throws MalformedRangeException  if the range end has more components than the start path
     */
    public static Urn parse(String value) {
        if (!isUrn(value)) {
            throw new IllegalArgumentException("Not a URN: " + value);
        }
        String body = value;
        String project = null;
        int at = body.lastIndexOf('@');
        if (at >= 0) {
            project = body.substring(at + 1).trim();
            body = body.substring(0, at);
            if (project.isEmpty()) {
                throw new IllegalArgumentException("Empty project qualifier: " + value);
            }
        }

        String[] slashParts = body.split("/", -1);
        String[] head = slashParts[0].split(":", 4);
        if (head.length < 4 || head[1].isEmpty() || head[2].isEmpty() || head[3].isEmpty()) {
            throw new IllegalArgumentException("URN needs namespace, type and name: " + value);
        }
        List<String> parts = new ArrayList<>();
        parts.add(head[3]);
        for (int i = 1; i < slashParts.length; i++) {
            if (slashParts[i].isEmpty()) {
                throw new IllegalArgumentException("Empty path component in URN: " + value);
            }
            parts.add(slashParts[i]);
        }

        // the last slash component holding a dash starts the range
        int rangeIndex = -1;
        for (int i = parts.size() - 1; i > 0; i--) {
            if (parts.get(i).contains("-")) {
                rangeIndex = i;
                break;
            }
        }
        if (rangeIndex < 0) {
            return new Urn(head[1], head[2], parts, null, project);
        }

        String rangePart = parts.get(rangeIndex);
        int dash = rangePart.indexOf('-');
        List<String> start = new ArrayList<>(parts.subList(0, rangeIndex));
        start.add(rangePart.substring(0, dash));

        List<String> endSpec = new ArrayList<>();
        endSpec.add(rangePart.substring(dash + 1));
        endSpec.addAll(parts.subList(rangeIndex + 1, parts.size()));
        for (String component : endSpec) {
            if (component.isEmpty()) {
                throw new MalformedRangeException("empty range component in " + value);
            }
        }
        if (start.get(start.size() - 1).isEmpty()) {
            throw new MalformedRangeException("empty range start in " + value);
        }
        int keep = start.size() - endSpec.size();
        if (keep < 1) {
            throw new MalformedRangeException("range end '" + String.join("/", endSpec)
                + "' is deeper than the start path of " + value);
        }
        List<String> end = new ArrayList<>(start.subList(0, keep));
        end.addAll(endSpec);
        return new Urn(head[1], head[2], start, end, project);
    }

    /**
     * Combine a start URN and a separately given end URN into one range.
     *
     * @throws MalformedRangeException if the two are not at the same depth or differ in namespace/type
     */
    public static Urn range(Urn start, Urn end) {
        if (start.isRange() || end.isRange()) {
            throw new MalformedRangeException("cannot combine ranged URNs " + start + " and " + end);
        }
        if (!start.namespace.equals(end.namespace) || !start.type.equals(end.type)) {
            throw new MalformedRangeException("range " + start + " .. " + end + " spans namespaces");
        }
        if (start.depth() != end.depth()) {
            throw new MalformedRangeException("range start " + start.canonical() + " (depth " + start.depth()
                + ") and end " + end.canonical() + " (depth " + end.depth() + ") differ in depth");
        }
        String project = start.project != null ? start.project : end.project;
        return new Urn(start.namespace, start.type, start.path, end.path, project);
    }

    public String getNamespace() { return namespace; }
    public String getType() { return type; }
    public List<String> getPath() { return path; }
    public List<String> getEndPath() { return endPath; }
    public String getProject() { return project; }

    public boolean isRange() {
        return endPath != null;
    }

    public boolean isQualified() {
        return project != null;
    }

    public int depth() {
        return path.size();
    }

    /**
     * Canonical form of the start, without range or project: the index key.
     */
    public String canonical() {
        return render(path);
    }

    /**
     * Canonical form of the end; equal to {@link #canonical()} for a single passage.
     */
    public String endCanonical() {
        return render(endPath != null ? endPath : path);
    }

    public Urn start() {
        return new Urn(namespace, type, path, null, project);
    }

    public Urn end() {
        return new Urn(namespace, type, endPath != null ? endPath : path, null, project);
    }

    public Urn withProject(String project) {
        return new Urn(namespace, type, path, endPath, project);
    }

    private String render(List<String> segments) {
        return SCHEME + ":" + namespace + ":" + type + ":" + String.join("/", segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Urn)) return false;
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        String s = canonical();
        if (endPath != null) {
            s = s + ".." + endCanonical();
        }
        return project != null ? s + "@" + project : s;
    }
}
