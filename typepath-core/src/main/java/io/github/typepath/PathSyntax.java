package io.github.typepath;

/// Lexical constants and string helpers shared by the parser, enumerator and resolver.
final class PathSyntax {

    static final char SEPARATOR = '.';
    static final char OPEN = '[';
    static final char CLOSE = ']';

    /// Dictionary key placeholder in patterns
    static final String ANY_KEY = "*";

    /// Index placeholder in patterns
    static final String ANY_INDEX = "[*]";

    /// Longest decimal text accepted as an index; anything longer cannot fit an int.
    private static final int MAX_INDEX_DIGITS = 10;

    private PathSyntax() {}

    /// Appends a child path to a prefix: `a` + `b` is `a.b`, `a` + `[*]` is `a[*]`.
    static String join(String prefix, String child) {
        if (prefix.isEmpty()) {
            return child;
        }
        if (child.isEmpty()) {
            return prefix;
        }
        return child.charAt(0) == OPEN ? prefix + child : prefix + SEPARATOR + child;
    }

    static String index(int position) {
        return OPEN + Integer.toString(position) + CLOSE;
    }

    /// @return true if the text is usable as a single dictionary key: non-empty, no separator, no brackets
    static boolean isBareKey(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == SEPARATOR || c == OPEN || c == CLOSE) {
                return false;
            }
        }
        return true;
    }

    /// Parses a non-negative decimal index.
    /// @return the index, or -1 if the text is not a non-negative int
    static int parseIndex(String text) {
        if (text.isEmpty() || text.length() > MAX_INDEX_DIGITS) {
            return -1;
        }
        long value = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value > Integer.MAX_VALUE ? -1 : (int) value;
    }
}
