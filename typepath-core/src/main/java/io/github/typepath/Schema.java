package io.github.typepath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Structural description of a value's shape.
///
/// A schema is one of eight mutually exclusive forms:
/// - TerminalSchema: an atomic leaf (number, string, timestamp, ...)
/// - ObjectSchema: explicitly declared, named fields, each required or optional
/// - DictionarySchema: open string-keyed map, every key has the same value shape
/// - ArraySchema: homogeneous, index-addressed sequence
/// - TupleSchema: fixed-length, heterogeneous, index-addressed sequence
/// - UnionSchema: the value is one of several shapes
/// - OptionalSchema: the wrapped shape may be absent
/// - RefSchema: a named handle resolved through a [SchemaGraph], enabling recursive shapes
///
/// Schemas are immutable and may be shared freely.
public sealed interface Schema permits
        Schema.TerminalSchema,
        Schema.ObjectSchema,
        Schema.DictionarySchema,
        Schema.ArraySchema,
        Schema.TupleSchema,
        Schema.UnionSchema,
        Schema.OptionalSchema,
        Schema.RefSchema {

    /// Atomic leaf
    record TerminalSchema(TerminalKind kind) implements Schema {
        public TerminalSchema {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public String toString() {
            return kind.label();
        }
    }

    /// A declared field: its shape plus whether the field may be missing
    record Field(Schema schema, boolean optional) {
        public Field {
            Objects.requireNonNull(schema, "schema must not be null");
        }
    }

    /// Object with explicitly declared fields. Field names may contain dots between
    /// non-empty parts; they may not contain brackets, and no part may be the key wildcard `*`.
    record ObjectSchema(Map<String, Field> fields) implements Schema {
        public ObjectSchema {
            Objects.requireNonNull(fields, "fields must not be null");
            fields.forEach((name, field) -> {
                checkFieldName(name);
                Objects.requireNonNull(field, "field must not be null: " + name);
            });
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        /// @return the declared field, or null when no such field exists
        public Field field(String name) {
            return fields.get(name);
        }

        public static Builder builder() {
            return new Builder();
        }

        private static void checkFieldName(String name) {
            Objects.requireNonNull(name, "field name must not be null");
            if (name.isEmpty()) {
                throw new SchemaDefinitionException("Field name must not be empty");
            }
            if (name.indexOf('[') >= 0 || name.indexOf(']') >= 0) {
                throw new SchemaDefinitionException("Field name must not contain brackets: " + name);
            }
            // every dot-separated part must itself be a usable step
            for (final var part : name.split("\\.", -1)) {
                if (part.isEmpty()) {
                    throw new SchemaDefinitionException("Field name must not start or end with '.' or contain '..': " + name);
                }
                if (PathSyntax.ANY_KEY.equals(part)) {
                    throw new SchemaDefinitionException("Field name '*' is reserved for the key wildcard: " + name);
                }
            }
        }

        @Override
        public String toString() {
            final var sb = new StringBuilder("{");
            fields.forEach((name, field) -> {
                if (sb.length() > 1) {
                    sb.append(", ");
                }
                sb.append(name).append(field.optional() ? "?: " : ": ").append(field.schema());
            });
            return sb.append('}').toString();
        }

        /// Fluent builder for object schemas. Declaring the same field twice with a
        /// different definition is a [SchemaDefinitionException].
        public static final class Builder {
            private final Map<String, Field> fields = new LinkedHashMap<>();

            private Builder() {
            }

            public Builder required(String name, Schema schema) {
                return put(name, new Field(schema, false));
            }

            public Builder optional(String name, Schema schema) {
                return put(name, new Field(schema, true));
            }

            /// Copies all fields of another object in, flattening an intersection of the two shapes.
            public Builder include(ObjectSchema other) {
                Objects.requireNonNull(other, "other must not be null");
                other.fields().forEach(this::put);
                return this;
            }

            public ObjectSchema build() {
                return new ObjectSchema(fields);
            }

            private Builder put(String name, Field field) {
                final var previous = fields.putIfAbsent(name, field);
                if (previous != null && !previous.equals(field)) {
                    throw new SchemaDefinitionException("Conflicting declarations for field: " + name);
                }
                return this;
            }
        }
    }

    /// Open-ended string-keyed map
    record DictionarySchema(Schema value) implements Schema {
        public DictionarySchema {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toString() {
            return "{[key]: " + value + "}";
        }
    }

    /// Homogeneous sequence
    record ArraySchema(Schema element) implements Schema {
        public ArraySchema {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String toString() {
            return element + "[]";
        }
    }

    /// Fixed-length heterogeneous sequence
    record TupleSchema(List<Schema> elements) implements Schema {
        public TupleSchema {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        /// @return the slot shape, or null when the position is outside the tuple
        public Schema slot(int position) {
            return position >= 0 && position < elements.size() ? elements.get(position) : null;
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    /// One of several shapes. Nested unions are flattened and duplicate variants removed,
    /// keeping first-seen order; at least two distinct variants must remain.
    record UnionSchema(List<Schema> variants) implements Schema {
        public UnionSchema {
            Objects.requireNonNull(variants, "variants must not be null");
            variants = flatten(variants);
            if (variants.size() < 2) {
                throw new SchemaDefinitionException("Union must have at least 2 distinct variants");
            }
        }

        private static List<Schema> flatten(List<Schema> variants) {
            final var distinct = new LinkedHashSet<Schema>();
            for (final var variant : variants) {
                Objects.requireNonNull(variant, "variant must not be null");
                if (variant instanceof UnionSchema nested) {
                    distinct.addAll(nested.variants());
                } else {
                    distinct.add(variant);
                }
            }
            return List.copyOf(distinct);
        }

        @Override
        public String toString() {
            final var sb = new StringBuilder();
            for (final var variant : variants) {
                if (sb.length() > 0) {
                    sb.append(" | ");
                }
                sb.append(variant);
            }
            return sb.toString();
        }
    }

    /// A shape that may be absent
    record OptionalSchema(Schema inner) implements Schema {
        public OptionalSchema {
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public String toString() {
            return inner + "?";
        }
    }

    /// Named reference into a [SchemaGraph]'s definitions
    record RefSchema(String name) implements Schema {
        public RefSchema {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new SchemaDefinitionException("Reference name must not be blank");
            }
        }

        @Override
        public String toString() {
            return "#" + name;
        }
    }

    // ========== Factories ==========

    static TerminalSchema terminal(TerminalKind kind) {
        return new TerminalSchema(kind);
    }

    static TerminalSchema number() {
        return new TerminalSchema(TerminalKind.NUMBER);
    }

    static TerminalSchema string() {
        return new TerminalSchema(TerminalKind.STRING);
    }

    static TerminalSchema bool() {
        return new TerminalSchema(TerminalKind.BOOLEAN);
    }

    static TerminalSchema timestamp() {
        return new TerminalSchema(TerminalKind.TIMESTAMP);
    }

    static TerminalSchema nullValue() {
        return new TerminalSchema(TerminalKind.NULL);
    }

    static ObjectSchema.Builder object() {
        return ObjectSchema.builder();
    }

    static DictionarySchema dictionaryOf(Schema value) {
        return new DictionarySchema(value);
    }

    static ArraySchema arrayOf(Schema element) {
        return new ArraySchema(element);
    }

    static TupleSchema tupleOf(Schema... elements) {
        return new TupleSchema(List.of(elements));
    }

    static OptionalSchema optional(Schema inner) {
        return new OptionalSchema(inner);
    }

    static RefSchema ref(String name) {
        return new RefSchema(name);
    }

    static Schema union(Schema... variants) {
        return union(List.of(variants));
    }

    /// Builds a union, collapsing to the single variant when only one distinct shape remains.
    /// @throws SchemaDefinitionException if no variants are given
    static Schema union(List<Schema> variants) {
        Objects.requireNonNull(variants, "variants must not be null");
        final var distinct = UnionSchema.flatten(new ArrayList<>(variants));
        if (distinct.isEmpty()) {
            throw new SchemaDefinitionException("Union must have at least 1 variant");
        }
        return distinct.size() == 1 ? distinct.get(0) : new UnionSchema(distinct);
    }
}
