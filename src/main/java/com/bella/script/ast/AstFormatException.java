package com.bella.script.ast;

/** Raised when a JSON document does not describe a well-formed Bella tree. */
public class AstFormatException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String path;

    public AstFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public AstFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /** JSON path of the offending node, e.g. {@code $.body.statements[2].initializer}. */
    public String path() {
        return path;
    }
}
