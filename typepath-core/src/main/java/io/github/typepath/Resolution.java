package io.github.typepath;

import java.util.Objects;
import java.util.Optional;

/// Result of resolving a path against a schema: the shape found there, or the
/// `Unresolvable` sentinel. Resolution never throws for a well-formed schema graph;
/// malformed paths are `Unresolvable` too.
public sealed interface Resolution permits Resolution.Resolved, Resolution.Unresolvable {

    /// The path that was resolved
    String path();

    /// The path is valid; `shape` is the normalised shape found there
    record Resolved(String path, Schema shape) implements Resolution {
        public Resolved {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(shape, "shape must not be null");
        }
    }

    /// No rule of the path grammar matches the path under the schema
    record Unresolvable(String path) implements Resolution {
        public Unresolvable {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    default Optional<Schema> toOptional() {
        return this instanceof Resolved resolved ? Optional.of(resolved.shape()) : Optional.empty();
    }
}
