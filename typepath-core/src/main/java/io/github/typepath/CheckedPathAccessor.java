package io.github.typepath;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Decorates a caller-supplied [PathAccessor] so that only paths valid for a schema reach it.
///
/// ```java
/// PathAccessor<Map<String, Object>> checked = new CheckedPathAccessor<>(graph, mapAccessor);
/// checked.get(order, "items[0].id");   // delegates
/// checked.get(order, "items[0].nope"); // InvalidPathException, delegate never called
/// ```
///
/// @param <D> the data structure type
public final class CheckedPathAccessor<D> implements PathAccessor<D> {

    private static final Logger LOG = Logger.getLogger(CheckedPathAccessor.class.getName());

    private final SchemaGraph graph;
    private final PathOptions options;
    private final PathAccessor<D> delegate;

    public CheckedPathAccessor(SchemaGraph graph, PathAccessor<D> delegate) {
        this(graph, PathOptions.DEFAULT, delegate);
    }

    public CheckedPathAccessor(SchemaGraph graph, PathOptions options, PathAccessor<D> delegate) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    /// @throws InvalidPathException if the path does not resolve
    @Override
    public Optional<Object> get(D data, String path) {
        shapeAt(path);
        return delegate.get(data, path);
    }

    /// @throws InvalidPathException if the path does not resolve
    @Override
    public D set(D data, String path, Object value) {
        shapeAt(path);
        return delegate.set(data, path, value);
    }

    /// @return the shape a value at this path has
    /// @throws InvalidPathException if the path does not resolve
    public Schema shapeAt(String path) {
        Objects.requireNonNull(path, "path must not be null");
        final var resolution = TypePaths.resolve(graph, path, options);
        if (resolution instanceof Resolution.Resolved resolved) {
            return resolved.shape();
        }
        LOG.fine(() -> "Rejected access through unresolvable path: " + path);
        throw new InvalidPathException(path);
    }
}
