package io.github.typepath;

/// Thrown by [CheckedPathAccessor] when a path does not resolve against its schema.
public class InvalidPathException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public InvalidPathException(String path) {
        super("Path does not resolve against the schema: '" + path + "'");
        this.path = path;
    }

    public String path() {
        return path;
    }
}
