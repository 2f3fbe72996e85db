package com.opensiddur.errors;

public class UnmatchedConditionalException extends CompilationException {

    public UnmatchedConditionalException(String detail) {
        super(ErrorCode.UNMATCHED_CONDITIONAL, detail);
    }

    public UnmatchedConditionalException(String detail, String project, String document, String nodePath) {
        super(ErrorCode.UNMATCHED_CONDITIONAL, detail, project, document, nodePath);
    }
}
