package io.github.typepath;

/// Exception thrown when a schema or schema graph is structurally defective:
/// a dangling reference, a reference cycle that never reaches an object, array,
/// tuple or dictionary, an illegal field name, or a degenerate union.
///
/// Raised while the schema is being built, never from path enumeration or resolution.
public class SchemaDefinitionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String definition;

    /// Creates a new exception not tied to a named definition.
    public SchemaDefinitionException(String message) {
        super(message);
        this.definition = null;
    }

    /// Creates a new exception for the named definition.
    public SchemaDefinitionException(String message, String definition) {
        super(definition == null ? message : message + " [definition: " + definition + "]");
        this.definition = definition;
    }

    /// Returns the definition in which the defect was found, or null if unknown.
    public String definition() {
        return definition;
    }
}
