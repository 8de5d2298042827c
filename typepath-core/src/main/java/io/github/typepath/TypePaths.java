package io.github.typepath;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Entry point: enumerate the valid path patterns of a schema, or resolve a path to the
/// shape found there.
///
/// Usage examples:
/// ```java
/// Schema order = Schema.object()
///     .required("items", Schema.arrayOf(Schema.object()
///         .required("id", Schema.number())
///         .required("tags", Schema.arrayOf(Schema.string()))
///         .build()))
///     .build();
///
/// Set<PathPattern> patterns = TypePaths.enumeratePaths(order);
/// // items, items[*], items[*].id, items[*].tags, items[*].tags[*]
///
/// Resolution r = TypePaths.resolve(order, "items[0].tags[1]");
/// // Resolved[path=items[0].tags[1], shape=string]
/// ```
///
/// All operations are pure functions of their arguments and safe to call concurrently.
public final class TypePaths {

    private static final Logger LOG = Logger.getLogger(TypePaths.class.getName());

    private TypePaths() {}

    // ========== Enumeration ==========

    /// Enumerates with the default depth of 5.
    /// @throws SchemaDefinitionException if the schema contains a reference
    public static Set<PathPattern> enumeratePaths(Schema schema) {
        return enumeratePaths(SchemaGraph.of(schema), PathOptions.DEFAULT);
    }

    public static Set<PathPattern> enumeratePaths(SchemaGraph graph) {
        return enumeratePaths(graph, PathOptions.DEFAULT);
    }

    public static Set<PathPattern> enumeratePaths(SchemaGraph graph, int maxDepth) {
        return enumeratePaths(graph, PathOptions.DEFAULT.withMaxDepth(maxDepth));
    }

    /// @return an unmodifiable set of distinct patterns, in discovery order
    public static Set<PathPattern> enumeratePaths(SchemaGraph graph, PathOptions options) {
        final Set<PathPattern> patterns = streamPaths(graph, options)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        LOG.fine(() -> "Enumerated " + patterns.size() + " path patterns");
        return Collections.unmodifiableSet(patterns);
    }

    /// Lazy form of [#enumeratePaths(SchemaGraph, PathOptions)].
    public static Stream<PathPattern> streamPaths(SchemaGraph graph, PathOptions options) {
        return PathEnumerator.stream(graph, options);
    }

    // ========== Resolution ==========

    /// @throws SchemaDefinitionException if the schema contains a reference
    public static Resolution resolve(Schema schema, String path) {
        return resolve(SchemaGraph.of(schema), path, PathOptions.DEFAULT);
    }

    public static Resolution resolve(SchemaGraph graph, String path) {
        return resolve(graph, path, PathOptions.DEFAULT);
    }

    /// Resolves a concrete path. Malformed paths are `Unresolvable`, never an exception.
    public static Resolution resolve(SchemaGraph graph, String path, PathOptions options) {
        return PathResolver.resolve(graph, path, options);
    }

    public static boolean isValid(SchemaGraph graph, String path) {
        return resolve(graph, path).isResolved();
    }

    /// Resolves a path and records which rule matched at each step.
    public static ResolutionTrace explain(SchemaGraph graph, String path) {
        return explain(graph, path, PathOptions.DEFAULT);
    }

    public static ResolutionTrace explain(SchemaGraph graph, String path, PathOptions options) {
        Objects.requireNonNull(graph, "graph must not be null");
        return PathResolver.explain(graph, path, options);
    }
}
