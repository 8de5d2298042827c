package io.github.typepath;

/// Exception thrown when a path or path pattern does not match the path grammar.
/// `TypePaths.resolve` never throws it: malformed input resolves to `Unresolvable`.
public class PathParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String path;

    /// Creates a new parse exception with position information.
    public PathParseException(String message, String path, int position) {
        super(formatMessage(message, path, position));
        this.position = position;
        this.path = path;
    }

    /// Returns the position in the path where the error occurred.
    public int position() {
        return position;
    }

    /// Returns the path that was being parsed.
    public String path() {
        return path;
    }

    private static String formatMessage(String message, String path, int position) {
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        sb.append(" in path: '").append(path).append('\'');
        if (position < path.length()) {
            sb.append(" (near '").append(path.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
