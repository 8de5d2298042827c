package io.github.typepath;

import java.util.Optional;

/// Reads and writes values of a data structure through a path string.
///
/// Implementations are supplied by the caller (a map walker, a bean navigator, a form
/// binding layer). Reading through an absent optional value yields `Optional.empty()`,
/// never an error.
///
/// @param <D> the data structure type
public interface PathAccessor<D> {

    Optional<Object> get(D data, String path);

    /// @return the updated data structure (the same instance for mutable structures)
    D set(D data, String path, Object value);
}
