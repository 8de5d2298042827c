package io.github.typepath;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static io.github.typepath.Schema.ArraySchema;
import static io.github.typepath.Schema.DictionarySchema;
import static io.github.typepath.Schema.ObjectSchema;
import static io.github.typepath.Schema.OptionalSchema;
import static io.github.typepath.Schema.RefSchema;
import static io.github.typepath.Schema.TerminalSchema;
import static io.github.typepath.Schema.TupleSchema;
import static io.github.typepath.Schema.UnionSchema;

/// Produces the path patterns of a schema graph as a lazy stream.
///
/// An object or dictionary needs one unit of the [DepthBudget] to list its keys. A level
/// entered through a key (an object field or a dictionary key) is charged one unit on
/// entry; a level entered through an index is not, so array and tuple elements are listed
/// at the budget of the object that declares them. Once nothing is left to list a level's
/// keys with, the branch is silently truncated.
///
/// Every tuple slot is written `[*]`; the patterns below it are the set-join of the slots'
/// own patterns. A reference met again before any budget has been spent since its previous
/// visit (an array-of-itself cycle) is charged one unit like a keyed level.
final class PathEnumerator {

    private static final Logger LOG = Logger.getLogger(PathEnumerator.class.getName());

    private final SchemaGraph graph;
    private final PrecedencePolicy policy;

    private PathEnumerator(SchemaGraph graph, PrecedencePolicy policy) {
        this.graph = graph;
        this.policy = policy;
    }

    /// @return distinct patterns in discovery order
    static Stream<PathPattern> stream(SchemaGraph graph, PathOptions options) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Enumerating paths with " + options.summary());
        final var enumerator = new PathEnumerator(graph, PrecedencePolicy.forOptions(options));
        return enumerator.paths(graph.root(), options.budget(), Set.of(), false)
                .distinct()
                .map(PathPattern::new);
    }

    /// @param keyed true when `schema` was reached through a key that has not been charged yet
    private Stream<String> paths(Schema schema, DepthBudget budget, Set<String> refsSinceCharge, boolean keyed) {
        if (schema instanceof TerminalSchema) {
            return Stream.empty();
        }
        if (schema instanceof RefSchema ref) {
            final var target = graph.definition(ref.name());
            if (keyed || !refsSinceCharge.contains(ref.name())) {
                return paths(target, budget, plus(refsSinceCharge, ref.name()), keyed);
            }
            final var charged = charge(budget);
            if (charged == null) {
                LOG.finest(() -> "Stopping at revisited reference " + ref.name());
                return Stream.empty();
            }
            return paths(target, charged, Set.of(ref.name()), false);
        }
        if (schema instanceof OptionalSchema optional) {
            return paths(optional.inner(), budget, refsSinceCharge, keyed);
        }
        if (schema instanceof UnionSchema union) {
            return union.variants().stream()
                    .flatMap(variant -> paths(variant, budget, refsSinceCharge, keyed));
        }
        if (schema instanceof ArraySchema array) {
            return prefixed(PathSyntax.ANY_INDEX, paths(array.element(), budget, refsSinceCharge, false));
        }
        if (schema instanceof TupleSchema tuple) {
            return prefixed(PathSyntax.ANY_INDEX, tuple.elements().stream()
                    .flatMap(slot -> paths(slot, budget, refsSinceCharge, false)));
        }

        final var own = keyed ? charge(budget) : budget;
        if (own == null || own.isExhausted()) {
            return Stream.empty();
        }
        final Set<String> refs = keyed ? Set.of() : refsSinceCharge;
        if (schema instanceof ObjectSchema object) {
            return object.fields().entrySet().stream()
                    .flatMap(entry -> prefixed(entry.getKey(), paths(entry.getValue().schema(), own, refs, true)));
        }
        if (schema instanceof DictionarySchema dictionary) {
            if (!policy.allows(ResolutionRule.DICTIONARY_DESCENT)) {
                return Stream.of(PathSyntax.ANY_KEY);
            }
            return prefixed(PathSyntax.ANY_KEY, paths(dictionary.value(), own, refs, true));
        }
        throw new IllegalStateException("Unknown schema type: " + schema.getClass().getName());
    }

    /// One unit spent; null when that would leave nothing to list keys with.
    private static DepthBudget charge(DepthBudget budget) {
        if (budget.isExhausted()) {
            return null;
        }
        final var next = budget.descend();
        return next.isExhausted() ? null : next;
    }

    /// The step itself followed by every child path below it.
    private static Stream<String> prefixed(String step, Stream<String> children) {
        return Stream.concat(Stream.of(step), children.map(child -> PathSyntax.join(step, child)));
    }

    private static Set<String> plus(Set<String> names, String name) {
        final var out = new HashSet<>(names);
        out.add(name);
        return out;
    }
}
