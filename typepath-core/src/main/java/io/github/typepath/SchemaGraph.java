package io.github.typepath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import static io.github.typepath.Schema.ArraySchema;
import static io.github.typepath.Schema.DictionarySchema;
import static io.github.typepath.Schema.ObjectSchema;
import static io.github.typepath.Schema.OptionalSchema;
import static io.github.typepath.Schema.RefSchema;
import static io.github.typepath.Schema.TupleSchema;
import static io.github.typepath.Schema.UnionSchema;

/// A root schema plus the named definitions its references point at.
///
/// The graph is validated when it is built: every reference must name an existing
/// definition, and no reference cycle may pass only through references, unions and
/// optional wrappers (such a cycle describes no structure and could never be traversed).
/// Cycles through objects, dictionaries, arrays or tuples are how recursive shapes are
/// expressed and are accepted.
///
/// ```java
/// SchemaGraph graph = SchemaGraph.builder()
///     .define("Node", Schema.object()
///         .required("name", Schema.string())
///         .optional("child", Schema.ref("Node"))
///         .build())
///     .root(Schema.ref("Node"))
///     .build();
/// ```
public record SchemaGraph(Schema root, Map<String, Schema> definitions) {

    private static final Logger LOG = Logger.getLogger(SchemaGraph.class.getName());

    public SchemaGraph {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(definitions, "definitions must not be null");
        definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        validate(root, definitions);
    }

    /// Creates a graph without definitions.
    /// @throws SchemaDefinitionException if the schema contains any reference
    public static SchemaGraph of(Schema root) {
        return new SchemaGraph(root, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return the definition for the name
    /// @throws SchemaDefinitionException if no such definition exists
    public Schema definition(String name) {
        final var schema = definitions.get(name);
        if (schema == null) {
            throw new SchemaDefinitionException("Unknown definition: " + name);
        }
        return schema;
    }

    /// Follows references until a non-reference schema is reached.
    public Schema deref(Schema schema) {
        var current = schema;
        while (current instanceof RefSchema ref) {
            current = definition(ref.name());
        }
        return current;
    }

    /// Returns a graph sharing these definitions with a different root.
    public SchemaGraph withRoot(Schema newRoot) {
        return new SchemaGraph(newRoot, definitions);
    }

    private static void validate(Schema root, Map<String, Schema> definitions) {
        definitions.forEach((name, schema) -> {
            Objects.requireNonNull(name, "definition name must not be null");
            Objects.requireNonNull(schema, "definition must not be null: " + name);
            if (name.isBlank()) {
                throw new SchemaDefinitionException("Definition name must not be blank");
            }
            checkReferences(schema, definitions, name);
        });
        checkReferences(root, definitions, null);
        checkUnguardedCycles(definitions);
        LOG.fine(() -> "Validated schema graph with " + definitions.size() + " definitions");
    }

    private static void checkReferences(Schema schema, Map<String, Schema> definitions, String owner) {
        final var pending = new ArrayList<Schema>();
        pending.add(schema);
        while (!pending.isEmpty()) {
            final var current = pending.remove(pending.size() - 1);
            if (current instanceof RefSchema ref) {
                if (!definitions.containsKey(ref.name())) {
                    throw new SchemaDefinitionException("Dangling reference: " + ref.name(), owner);
                }
            } else if (current instanceof ObjectSchema object) {
                object.fields().values().forEach(field -> pending.add(field.schema()));
            } else if (current instanceof DictionarySchema dictionary) {
                pending.add(dictionary.value());
            } else if (current instanceof ArraySchema array) {
                pending.add(array.element());
            } else if (current instanceof TupleSchema tuple) {
                pending.addAll(tuple.elements());
            } else if (current instanceof UnionSchema union) {
                pending.addAll(union.variants());
            } else if (current instanceof OptionalSchema optional) {
                pending.add(optional.inner());
            }
        }
    }

    private static void checkUnguardedCycles(Map<String, Schema> definitions) {
        final Map<String, Set<String>> edges = new HashMap<>();
        definitions.forEach((name, schema) -> edges.put(name, unguardedReferences(schema)));

        final Set<String> done = new HashSet<>();
        for (final var start : definitions.keySet()) {
            visit(start, edges, new LinkedHashSet<>(), done);
        }
    }

    private static void visit(String name, Map<String, Set<String>> edges, Set<String> onPath, Set<String> done) {
        if (done.contains(name)) {
            return;
        }
        if (!onPath.add(name)) {
            throw new SchemaDefinitionException("Reference cycle without structure: " + String.join(" -> ", onPath) + " -> " + name, name);
        }
        for (final var next : edges.get(name)) {
            visit(next, edges, onPath, done);
        }
        onPath.remove(name);
        done.add(name);
    }

    /// References reachable without passing through an object, dictionary, array or tuple.
    private static Set<String> unguardedReferences(Schema schema) {
        final var names = new LinkedHashSet<String>();
        final var pending = new ArrayList<Schema>(List.of(schema));
        while (!pending.isEmpty()) {
            final var current = pending.remove(pending.size() - 1);
            if (current instanceof RefSchema ref) {
                names.add(ref.name());
            } else if (current instanceof UnionSchema union) {
                pending.addAll(union.variants());
            } else if (current instanceof OptionalSchema optional) {
                pending.add(optional.inner());
            }
        }
        return names;
    }

    /// Collects named definitions and the root, validating on [#build()].
    public static final class Builder {
        private final Map<String, Schema> definitions = new LinkedHashMap<>();
        private Schema root;

        private Builder() {
        }

        public Builder define(String name, Schema schema) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(schema, "schema must not be null");
            if (definitions.putIfAbsent(name, schema) != null) {
                throw new SchemaDefinitionException("Duplicate definition", name);
            }
            return this;
        }

        public Builder root(Schema schema) {
            this.root = Objects.requireNonNull(schema, "schema must not be null");
            return this;
        }

        /// @throws SchemaDefinitionException if the graph has a dangling reference or an unguarded cycle
        /// @throws NullPointerException if no root was set
        public SchemaGraph build() {
            Objects.requireNonNull(root, "root must be set before build()");
            return new SchemaGraph(root, definitions);
        }
    }
}
