package com.opensiddur.index;

import com.opensiddur.models.DocumentKey;

/**
 * One project's definition of a URN: the document and the node that carries it.
 */
public record IndexEntry(String urn, String project, String documentPath, String nodePath) {

    public DocumentKey documentKey() {
        return new DocumentKey(project, documentPath);
    }
}
