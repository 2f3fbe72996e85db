package com.opensiddur.errors;

/**
 * Thrown at a transclusion boundary after the compile was asked to stop.
 */
public class CompilationCancelledException extends RuntimeException {
    private final String compileId;

    public CompilationCancelledException(String compileId) {
        super("Compile cancelled: " + compileId);
        this.compileId = compileId;
    }

    public String getCompileId() {
        return compileId;
    }
}
