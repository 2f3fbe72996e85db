package com.opensiddur.errors;

/**
 * A range whose start and end cannot describe one span.
 */
public class MalformedRangeException extends CompilationException {

    public MalformedRangeException(String detail) {
        super(ErrorCode.MALFORMED_RANGE, detail);
    }

    public MalformedRangeException(String detail, String project, String document, String nodePath) {
        super(ErrorCode.MALFORMED_RANGE, detail, project, document, nodePath);
    }
}
