package com.opensiddur.index;

import com.opensiddur.models.ElementNode;

/**
 * A standoff note (a {@code note} element with a {@code target}) found in a project's documents.
 */
public record NoteReference(String project, String documentPath, String nodePath, ElementNode note) {

    public String target() {
        return note.attribute(ElementNode.ATTR_TARGET);
    }

    public String targetEnd() {
        return note.attribute(ElementNode.ATTR_TARGET_END);
    }
}
