package com.opensiddur.index;

import com.opensiddur.models.DocumentKey;

/**
 * Start and end of a passage as one project defines it. For a single passage both are the same entry.
 * A split range has its ends in two different documents and cannot be extracted.
 */
public record ResolvedRange(IndexEntry start, IndexEntry end) {

    public String project() {
        return start.project();
    }

    public DocumentKey documentKey() {
        return start.documentKey();
    }

    public boolean isSingle() {
        return start.equals(end);
    }

    public boolean isSplit() {
        return !start.documentPath().equals(end.documentPath());
    }
}
