package io.github.typepath;

import java.util.List;
import java.util.Objects;

/// A path string as produced by path enumeration. Array and tuple positions are written
/// `[*]`, dictionary keys `*`.
///
/// Substituting real indices and keys for the placeholders yields a concrete path that
/// resolves against the schema the pattern was enumerated from, as long as every index
/// standing for a tuple position names a slot that leads on to the rest of the path:
/// ```java
/// PathPattern pattern = new PathPattern("users.*.tags[*]");
/// String path = pattern.instantiate(3, "alice"); // "users.alice.tags[3]"
/// ```
public record PathPattern(String text) implements Comparable<PathPattern> {

    public PathPattern {
        Objects.requireNonNull(text, "text must not be null");
    }

    /// @throws PathParseException if the text is not a well-formed pattern
    public List<PathSegment> segments() {
        return PathParser.parsePattern(text).segments();
    }

    /// @return true if the pattern contains no placeholders
    public boolean isConcrete() {
        return !PathParser.parsePattern(text).isPattern();
    }

    /// @return true if the concrete path is one of the paths this pattern stands for;
    ///         false for a malformed concrete path
    /// @throws PathParseException if this pattern is malformed
    public boolean matches(String concretePath) {
        Objects.requireNonNull(concretePath, "concretePath must not be null");
        if (!PathParser.isWellFormed(concretePath)) {
            return false;
        }
        return PathParser.parsePattern(text).covers(PathParser.parse(concretePath));
    }

    /// Substitutes `index` for every `[*]` and `key` for every `*`.
    /// @throws IllegalArgumentException if index is negative or key is not a bare key
    public String instantiate(int index, String key) {
        return PathParser.parsePattern(text).instantiate(index, key).toString();
    }

    @Override
    public int compareTo(PathPattern other) {
        return text.compareTo(other.text);
    }

    @Override
    public String toString() {
        return text;
    }
}
