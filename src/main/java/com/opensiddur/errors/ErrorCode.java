package com.opensiddur.errors;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCode {
    UNRESOLVED_URN("UnresolvedURN"),
    MALFORMED_RANGE("MalformedRange"),
    CYCLIC_TRANSCLUSION("CyclicTransclusion"),
    UNBALANCED_SCOPE("UnbalancedScope"),
    UNMATCHED_CONDITIONAL("UnmatchedConditional"),
    DANGLING_ANNOTATION_TARGET("DanglingAnnotationTarget");

    private final String label;

    ErrorCode(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
