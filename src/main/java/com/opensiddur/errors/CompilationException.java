package com.opensiddur.errors;

/**
 * Structural defect that aborts the compile of the current document.
 * The location (project, document, node path) is attached where the defect is found,
 * or by the traversal when a lower layer throws without one.
 */
public class CompilationException extends RuntimeException {
    private final ErrorCode code;
    private final String detail;
    private String project;
    private String document;
    private String nodePath;

    public CompilationException(ErrorCode code, String detail) {
        super(detail);
        this.code = code;
        this.detail = detail;
    }

    public CompilationException(ErrorCode code, String detail, String project, String document, String nodePath) {
        this(code, detail);
        this.project = project;
        this.document = document;
        this.nodePath = nodePath;
    }

    /**
     * Fill in the location if it is not already known.
     */
    public CompilationException at(String project, String document, String nodePath) {
        if (this.document == null) {
            this.project = project;
            this.document = document;
            this.nodePath = nodePath;
        }
        return this;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }

    public String getProject() {
        return project;
    }

    public String getDocument() {
        return document;
    }

    public String getNodePath() {
        return nodePath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(code.getLabel()).append(": ").append(detail);
        if (document != null) {
            sb.append(" [project=").append(project)
                .append(", document=").append(document)
                .append(", path=").append(nodePath).append(']');
        }
        return sb.toString();
    }
}
