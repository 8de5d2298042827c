package io.github.typepath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A parsed path: an ordered, non-empty sequence of segments.
///
/// ```java
/// AccessPath path = AccessPath.parse("items[0].tags[1]");
/// // [Field[name=items], Index[position=0], Field[name=tags], Index[position=1]]
/// ```
///
/// Note that parsing is purely syntactic: `a.b` always yields two field segments even
/// when a schema declares a field literally named `a.b`. Deciding between those readings
/// is the resolver's job.
public record AccessPath(List<PathSegment> segments) {

    public AccessPath {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("AccessPath must have at least one segment");
        }
        segments = List.copyOf(segments);
    }

    /// @throws PathParseException if the path is malformed or contains wildcards
    public static AccessPath parse(String path) {
        return PathParser.parse(path);
    }

    /// @throws PathParseException if the pattern is malformed
    public static AccessPath parsePattern(String pattern) {
        return PathParser.parsePattern(pattern);
    }

    /// @return true if the text is a well-formed concrete path
    public static boolean isWellFormed(String path) {
        return PathParser.isWellFormed(path);
    }

    /// @return true if any segment is a wildcard
    public boolean isPattern() {
        return segments.stream().anyMatch(PathSegment::isWildcard);
    }

    /// Replaces every `[*]` with `[index]` and every `*` key with `key`.
    /// @throws IllegalArgumentException if index is negative or key is not a bare key
    public AccessPath instantiate(int index, String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
        if (!PathSyntax.isBareKey(key)) {
            throw new IllegalArgumentException("key must be non-empty and contain no '.', '[' or ']': " + key);
        }
        final var out = new ArrayList<PathSegment>(segments.size());
        for (final var segment : segments) {
            if (segment instanceof PathSegment.AnyIndex) {
                out.add(new PathSegment.Index(index));
            } else if (segment instanceof PathSegment.AnyKey) {
                out.add(new PathSegment.Field(key));
            } else {
                out.add(segment);
            }
        }
        return new AccessPath(out);
    }

    /// @return true if this pattern covers the concrete path segment by segment
    public boolean covers(AccessPath concrete) {
        Objects.requireNonNull(concrete, "concrete must not be null");
        if (concrete.segments.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            final var mine = segments.get(i);
            final var theirs = concrete.segments.get(i);
            if (mine instanceof PathSegment.AnyIndex) {
                if (!(theirs instanceof PathSegment.Index)) {
                    return false;
                }
            } else if (mine instanceof PathSegment.AnyKey) {
                if (!(theirs instanceof PathSegment.Field)) {
                    return false;
                }
            } else if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    /// Renders the path text; parsing the result yields an equal path.
    @Override
    public String toString() {
        final var sb = new StringBuilder();
        for (final var segment : segments) {
            if (segment instanceof PathSegment.Field field) {
                if (sb.length() > 0) {
                    sb.append(PathSyntax.SEPARATOR);
                }
                sb.append(field.name());
            } else if (segment instanceof PathSegment.AnyKey) {
                if (sb.length() > 0) {
                    sb.append(PathSyntax.SEPARATOR);
                }
                sb.append(PathSyntax.ANY_KEY);
            } else if (segment instanceof PathSegment.Index index) {
                sb.append(PathSyntax.index(index.position()));
            } else {
                sb.append(PathSyntax.ANY_INDEX);
            }
        }
        return sb.toString();
    }
}
