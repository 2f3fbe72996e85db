package com.opensiddur.models;

/**
 * Identifies a declare or conditional block within one visit of one document.
 * Ids only need to be unique per document, and a document may be visited
 * several times in one compile, so the visit number is part of the identity.
 */
public record ScopeOwner(long visit, String id) {

    @Override
    public String toString() {
        return id + "@" + visit;
    }
}
