package io.github.typepath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Parser for access paths into segments.
/// Implements a single-pass recursive descent parser for the path grammar:
///
/// ```
/// path          := step ("." step)*
/// step          := field-name bracket-chain? | bracket-chain   (bracket-chain alone only first)
/// bracket-chain := "[" index "]" ("[" index "]")*
/// index         := digit+ | "*"                                ("*" in patterns only)
/// field-name    := one or more characters other than '.', '[' and ']'
/// ```
///
/// Examples: `name`, `items[0].tags[1]`, `[0][2].id`, `users.alice.role`.
/// In pattern mode a whole-segment `*` is a key wildcard and `[*]` an index wildcard.
final class PathParser {

    private static final Logger LOG = Logger.getLogger(PathParser.class.getName());

    private final String path;
    private final boolean pattern;
    private int pos;

    private PathParser(String path, boolean pattern) {
        this.path = path;
        this.pattern = pattern;
        this.pos = 0;
    }

    /// Parses a concrete path.
    /// @throws NullPointerException if path is null
    /// @throws PathParseException if the path is malformed or contains wildcards
    static AccessPath parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.finer(() -> "Parsing path: " + path);
        return new PathParser(path, false).parsePath();
    }

    /// Parses a path pattern, accepting `*` keys and `[*]` indices.
    /// @throws NullPointerException if pattern is null
    /// @throws PathParseException if the pattern is malformed
    static AccessPath parsePattern(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        LOG.finer(() -> "Parsing pattern: " + pattern);
        return new PathParser(pattern, true).parsePath();
    }

    /// @return true if the text is a well-formed concrete path
    static boolean isWellFormed(String path) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            parse(path);
            return true;
        } catch (PathParseException e) {
            LOG.finer(() -> "Malformed path: " + e.getMessage());
            return false;
        }
    }

    private AccessPath parsePath() {
        if (path.isEmpty()) {
            throw new PathParseException("Path must not be empty", path, 0);
        }

        final var segments = new ArrayList<PathSegment>();
        parseStep(segments, true);

        while (pos < path.length()) {
            if (path.charAt(pos) != PathSyntax.SEPARATOR) {
                throw new PathParseException("Expected '.' between segments", path, pos);
            }
            pos++; // skip .
            if (pos >= path.length()) {
                throw new PathParseException("Unexpected end of path after '.'", path, pos);
            }
            parseStep(segments, false);
        }

        return new AccessPath(segments);
    }

    private void parseStep(List<PathSegment> segments, boolean first) {
        final char c = path.charAt(pos);

        if (c == PathSyntax.OPEN) {
            // Root-level access: [0] or [0][1].name
            if (!first) {
                throw new PathParseException("Expected field name", path, pos);
            }
            parseBracketChain(segments);
            return;
        }

        segments.add(parseFieldName());

        if (pos < path.length() && path.charAt(pos) == PathSyntax.OPEN) {
            parseBracketChain(segments);
        }
    }

    private PathSegment parseFieldName() {
        final int start = pos;

        while (pos < path.length()) {
            final char c = path.charAt(pos);
            if (c == PathSyntax.SEPARATOR || c == PathSyntax.OPEN) {
                break;
            }
            if (c == PathSyntax.CLOSE) {
                throw new PathParseException("Unexpected ']' without matching '['", path, pos);
            }
            pos++;
        }

        if (pos == start) {
            throw new PathParseException("Expected field name", path, pos);
        }

        final var name = path.substring(start, pos);
        if (pattern && PathSyntax.ANY_KEY.equals(name)) {
            return new PathSegment.AnyKey();
        }
        return new PathSegment.Field(name);
    }

    private void parseBracketChain(List<PathSegment> segments) {
        while (pos < path.length() && path.charAt(pos) == PathSyntax.OPEN) {
            pos++; // skip [

            if (pos >= path.length()) {
                throw new PathParseException("Unexpected end of path after '['", path, pos);
            }

            if (path.charAt(pos) == '*') {
                if (!pattern) {
                    throw new PathParseException("Wildcard index is only allowed in patterns", path, pos);
                }
                pos++; // skip *
                expectChar(PathSyntax.CLOSE);
                segments.add(new PathSegment.AnyIndex());
                continue;
            }

            final int start = pos;
            while (pos < path.length() && isAsciiDigit(path.charAt(pos))) {
                pos++;
            }
            if (pos == start) {
                throw new PathParseException("Expected non-negative array index", path, pos);
            }

            final int index = PathSyntax.parseIndex(path.substring(start, pos));
            if (index < 0) {
                throw new PathParseException("Array index out of range", path, start);
            }

            expectChar(PathSyntax.CLOSE);
            segments.add(new PathSegment.Index(index));
        }
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void expectChar(char expected) {
        if (pos >= path.length()) {
            throw new PathParseException("Unexpected end of path, expected '" + expected + "'", path, pos);
        }
        if (path.charAt(pos) != expected) {
            throw new PathParseException("Expected '" + expected + "'", path, pos);
        }
        pos++;
    }
}
