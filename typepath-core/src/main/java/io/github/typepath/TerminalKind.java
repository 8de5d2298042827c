package io.github.typepath;

/// Kinds of leaf shapes. Traversal never descends into a terminal, even when the
/// runtime value behind it is itself composite (a timestamp, a compiled pattern, a callable).
public enum TerminalKind {
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    TIMESTAMP("timestamp"),
    PATTERN("pattern"),
    FUNCTION("function"),
    PROMISE("promise"),
    NULL("null"),
    UNKNOWN("unknown");

    private final String label;

    TerminalKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
