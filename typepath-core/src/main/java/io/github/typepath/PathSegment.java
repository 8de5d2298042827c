package io.github.typepath;

import java.util.Objects;

/// One navigation step of an [AccessPath].
///
/// Concrete paths consist of `Field` and `Index` steps only. Path patterns may also
/// contain `AnyKey` (a dictionary key placeholder, written `*`) and `AnyIndex`
/// (an array index placeholder, written `[*]`).
public sealed interface PathSegment permits
        PathSegment.Field,
        PathSegment.Index,
        PathSegment.AnyKey,
        PathSegment.AnyIndex {

    /// Named field or dictionary key: `name`
    record Field(String name) implements PathSegment {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// Literal position: `[n]`
    record Index(int position) implements PathSegment {
        public Index {
            if (position < 0) {
                throw new IllegalArgumentException("position must be >= 0: " + position);
            }
        }
    }

    /// Any dictionary key: `*`
    record AnyKey() implements PathSegment {}

    /// Any index: `[*]`
    record AnyIndex() implements PathSegment {}

    /// @return true for the pattern-only placeholders
    default boolean isWildcard() {
        return this instanceof AnyKey || this instanceof AnyIndex;
    }
}
