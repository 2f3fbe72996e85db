package com.opensiddur.errors;

import java.util.List;

public class CyclicTransclusionException extends CompilationException {
    private final List<String> cycle;

    public CyclicTransclusionException(List<String> cycle) {
        super(ErrorCode.CYCLIC_TRANSCLUSION, "transclusion cycle " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * The transclusions forming the cycle, first and last entries equal.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
