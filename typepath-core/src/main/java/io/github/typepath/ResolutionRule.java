package io.github.typepath;

/// Interpretations of the remaining path text against one shape, in priority order.
/// The resolver tries them top to bottom and takes the first that yields a shape.
public enum ResolutionRule {

    /// The whole text names a declared field (or a tuple slot number). An explicit key
    /// wins even when it contains a dot: `"a.b"` resolves to a field literally named `a.b`.
    EXPLICIT_KEY("explicit key"),

    /// The whole text is a bare dictionary key.
    INDEX_SIGNATURE_KEY("index-signature key"),

    /// `head.rest` where `head` is a declared, required, non-terminal field. Longer
    /// declared heads are tried before shorter ones.
    NESTED_EXPLICIT_KEY("nested explicit key"),

    /// `[n]...` on an array or tuple, or `name[n]...` where `name` is a declared field or a
    /// dictionary key holding one.
    INDEXED_ACCESS("indexed access"),

    /// `key.rest` on a dictionary: `rest` is resolved against the value shape.
    DICTIONARY_DESCENT("dictionary value descent"),

    /// `head.rest` where `head` is an optional field: one level of absence is unwrapped.
    OPTIONAL_CHAIN("optional chain");

    private final String description;

    ResolutionRule(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
