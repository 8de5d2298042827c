package io.github.typepath;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static io.github.typepath.Schema.Field;
import static io.github.typepath.Schema.ObjectSchema;
import static io.github.typepath.Schema.OptionalSchema;
import static io.github.typepath.Schema.RefSchema;
import static io.github.typepath.Schema.TerminalSchema;
import static io.github.typepath.Schema.TupleSchema;
import static io.github.typepath.Schema.UnionSchema;

/// The ordered interpretation rules plus the shape helpers that enumeration and
/// resolution must agree on for every enumerated pattern to resolve.
final class PrecedencePolicy {

    static final PrecedencePolicy DEFAULT = new PrecedencePolicy(EnumSet.allOf(ResolutionRule.class));

    private final List<ResolutionRule> rules;
    private final Set<ResolutionRule> enabled;

    private PrecedencePolicy(Set<ResolutionRule> enabled) {
        this.enabled = EnumSet.copyOf(enabled);
        // EnumSet iterates in declaration order, which is the priority order
        this.rules = List.copyOf(this.enabled);
    }

    static PrecedencePolicy forOptions(PathOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (options.dictionaryValueDescent()) {
            return DEFAULT;
        }
        final var rules = EnumSet.allOf(ResolutionRule.class);
        rules.remove(ResolutionRule.DICTIONARY_DESCENT);
        return new PrecedencePolicy(rules);
    }

    List<ResolutionRule> rules() {
        return rules;
    }

    boolean allows(ResolutionRule rule) {
        return enabled.contains(rule);
    }

    /// The member a field name or tuple slot number refers to, or null.
    static Field member(Schema shape, String name) {
        if (shape instanceof ObjectSchema object) {
            return object.field(name);
        }
        if (shape instanceof TupleSchema tuple) {
            final int position = PathSyntax.parseIndex(name);
            final var slot = position < 0 ? null : tuple.slot(position);
            return slot == null ? null : new Field(slot, false);
        }
        return null;
    }

    /// @return true if the member may be absent, by declaration or by an optional wrapper
    static boolean isOptional(SchemaGraph graph, Field member) {
        return member.optional() || graph.deref(member.schema()) instanceof OptionalSchema;
    }

    /// Strips references and optional wrappers; unions are normalised variant by variant.
    static Schema normalize(SchemaGraph graph, Schema schema) {
        final var shape = unwrap(graph, schema);
        if (shape instanceof UnionSchema union) {
            final var variants = new ArrayList<Schema>(union.variants().size());
            for (final var variant : union.variants()) {
                variants.add(normalize(graph, variant));
            }
            return Schema.union(variants);
        }
        return shape;
    }

    /// Strips references and optional wrappers from the top of a schema.
    static Schema unwrap(SchemaGraph graph, Schema schema) {
        var current = schema;
        while (current instanceof RefSchema || current instanceof OptionalSchema) {
            current = current instanceof OptionalSchema optional ? optional.inner() : graph.deref(current);
        }
        return current;
    }

    /// @return true if no path can continue below this schema
    static boolean isTerminal(SchemaGraph graph, Schema schema) {
        final var shape = unwrap(graph, schema);
        if (shape instanceof UnionSchema union) {
            return union.variants().stream().allMatch(variant -> isTerminal(graph, variant));
        }
        return shape instanceof TerminalSchema;
    }
}
