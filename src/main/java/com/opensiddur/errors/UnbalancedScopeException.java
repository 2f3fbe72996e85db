package com.opensiddur.errors;

public class UnbalancedScopeException extends CompilationException {

    public UnbalancedScopeException(String detail) {
        super(ErrorCode.UNBALANCED_SCOPE, detail);
    }

    public UnbalancedScopeException(String detail, String project, String document, String nodePath) {
        super(ErrorCode.UNBALANCED_SCOPE, detail, project, document, nodePath);
    }
}
