package com.opensiddur.errors;

/**
 * A reference that no project in scope defines.
 */
public class UnresolvedUrnException extends CompilationException {

    public UnresolvedUrnException(String detail) {
        super(ErrorCode.UNRESOLVED_URN, detail);
    }

    public UnresolvedUrnException(String detail, String project, String document, String nodePath) {
        super(ErrorCode.UNRESOLVED_URN, detail, project, document, nodePath);
    }
}
