package com.opensiddur.errors;

/**
 * Recoverable problem reported alongside a successful compile.
 */
public class CompileWarning {
    private ErrorCode code;
    private String message;
    private String project;
    private String document;
    private String nodePath;

    public CompileWarning() {}

    public CompileWarning(ErrorCode code, String message, String project, String document, String nodePath) {
        this.code = code;
        this.message = message;
        this.project = project;
        this.document = document;
        this.nodePath = nodePath;
    }

    public ErrorCode getCode() { return code; }
    public void setCode(ErrorCode code) { this.code = code; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public String getDocument() { return document; }
    public void setDocument(String document) { this.document = document; }

    public String getNodePath() { return nodePath; }
    public void setNodePath(String nodePath) { this.nodePath = nodePath; }

    @Override
    public String toString() {
        return code.getLabel() + ": " + message + " [project=" + project + ", document=" + document + ", path=" + nodePath + "]";
    }
}
