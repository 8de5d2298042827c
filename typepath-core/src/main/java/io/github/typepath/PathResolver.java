package io.github.typepath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static io.github.typepath.Schema.ArraySchema;
import static io.github.typepath.Schema.DictionarySchema;
import static io.github.typepath.Schema.TupleSchema;
import static io.github.typepath.Schema.UnionSchema;

/// Resolves a path string against a schema graph.
///
/// Resolution works on the raw path text rather than on parsed segments, because a
/// declared field may itself contain a dot and the choice between "field `a.b`" and
/// "field `b` of field `a`" depends on the schema. The parser is only used to reject
/// malformed input up front.
///
/// At each step the current shape is normalised (references followed, optional wrappers
/// stripped), unions are distributed over their variants, and the [ResolutionRule]s are
/// tried in priority order. Internally a null shape means "unresolvable".
final class PathResolver {

    private static final Logger LOG = Logger.getLogger(PathResolver.class.getName());

    private final SchemaGraph graph;
    private final PrecedencePolicy policy;
    private final List<Attempt> trace;
    private int sequence;

    private record Attempt(int sequence, ResolutionTrace.Step step) {}

    private PathResolver(SchemaGraph graph, PrecedencePolicy policy, boolean tracing) {
        this.graph = graph;
        this.policy = policy;
        this.trace = tracing ? new ArrayList<>() : null;
    }

    static Resolution resolve(SchemaGraph graph, String path, PathOptions options) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return new PathResolver(graph, PrecedencePolicy.forOptions(options), false).run(path);
    }

    static ResolutionTrace explain(SchemaGraph graph, String path, PathOptions options) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(options, "options must not be null");
        final var resolver = new PathResolver(graph, PrecedencePolicy.forOptions(options), true);
        final var result = resolver.run(path);
        final var steps = resolver.trace.stream()
                .sorted(Comparator.comparingInt(Attempt::sequence))
                .map(Attempt::step)
                .toList();
        return new ResolutionTrace(result, steps);
    }

    private Resolution run(String path) {
        if (!PathParser.isWellFormed(path)) {
            LOG.fine(() -> "Unresolvable (malformed): " + path);
            return new Resolution.Unresolvable(path);
        }
        final var shape = resolveAt(graph.root(), path, 0);
        if (shape == null) {
            LOG.fine(() -> "Unresolvable: " + path);
            return new Resolution.Unresolvable(path);
        }
        LOG.fine(() -> "Resolved " + path + " => " + shape);
        return new Resolution.Resolved(path, shape);
    }

    private Schema resolveAt(Schema schema, String key, int depth) {
        final var shape = PrecedencePolicy.unwrap(graph, schema);

        if (shape instanceof UnionSchema union) {
            final var results = new ArrayList<Schema>();
            for (final var variant : union.variants()) {
                final var result = resolveAt(variant, key, depth + 1);
                if (result != null) {
                    results.add(result);
                }
            }
            LOG.finest(() -> "Union at '" + key + "': " + results.size() + " of " + union.variants().size() + " variants resolved");
            return results.isEmpty() ? null : Schema.union(results);
        }

        for (final var rule : policy.rules()) {
            final int attempt = sequence++;
            final var result = apply(rule, shape, key, depth);
            if (result != null) {
                LOG.finer(() -> "Rule " + rule + " matched '" + key + "' at " + shape);
                if (trace != null) {
                    trace.add(new Attempt(attempt, new ResolutionTrace.Step(depth, rule, key, shape)));
                }
                return result;
            }
        }
        return null;
    }

    private Schema apply(ResolutionRule rule, Schema shape, String key, int depth) {
        return switch (rule) {
            case EXPLICIT_KEY -> explicitKey(shape, key);
            case INDEX_SIGNATURE_KEY -> indexSignatureKey(shape, key);
            case NESTED_EXPLICIT_KEY -> nestedExplicitKey(shape, key, depth);
            case INDEXED_ACCESS -> indexedAccess(shape, key, depth);
            case DICTIONARY_DESCENT -> dictionaryDescent(shape, key, depth);
            case OPTIONAL_CHAIN -> optionalChain(shape, key, depth);
        };
    }

    private Schema explicitKey(Schema shape, String key) {
        final var member = PrecedencePolicy.member(shape, key);
        return member == null ? null : PrecedencePolicy.normalize(graph, member.schema());
    }

    private Schema indexSignatureKey(Schema shape, String key) {
        if (shape instanceof DictionarySchema dictionary && PathSyntax.isBareKey(key)) {
            return PrecedencePolicy.normalize(graph, dictionary.value());
        }
        return null;
    }

    private Schema nestedExplicitKey(Schema shape, String key, int depth) {
        for (int dot = key.lastIndexOf(PathSyntax.SEPARATOR); dot > 0; dot = key.lastIndexOf(PathSyntax.SEPARATOR, dot - 1)) {
            final var member = PrecedencePolicy.member(shape, key.substring(0, dot));
            if (member == null
                    || PrecedencePolicy.isOptional(graph, member)
                    || PrecedencePolicy.isTerminal(graph, member.schema())) {
                continue;
            }
            final var result = resolveAt(member.schema(), key.substring(dot + 1), depth + 1);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private Schema indexedAccess(Schema shape, String key, int depth) {
        final int bracket = key.indexOf(PathSyntax.OPEN);
        if (bracket < 0) {
            return null;
        }
        if (bracket == 0) {
            return index(shape, key, depth);
        }

        // name[n]...: the bracket chain applies to the member called name
        final var base = key.substring(0, bracket);
        final Schema target;
        if (shape instanceof DictionarySchema dictionary) {
            if (!PathSyntax.isBareKey(base) || !policy.allows(ResolutionRule.DICTIONARY_DESCENT)) {
                return null;
            }
            target = dictionary.value();
        } else {
            final var member = PrecedencePolicy.member(shape, base);
            if (member == null) {
                return null;
            }
            target = member.schema();
        }
        return resolveAt(target, key.substring(bracket), depth + 1);
    }

    private Schema index(Schema shape, String key, int depth) {
        final int close = key.indexOf(PathSyntax.CLOSE);
        final int position = PathSyntax.parseIndex(key.substring(1, close));
        if (position < 0) {
            return null;
        }

        final Schema element;
        if (shape instanceof ArraySchema array) {
            element = array.element();
        } else if (shape instanceof TupleSchema tuple) {
            element = tuple.slot(position);
        } else {
            element = null;
        }
        if (element == null) {
            return null;
        }

        final var rest = key.substring(close + 1);
        if (rest.isEmpty()) {
            return PrecedencePolicy.normalize(graph, element);
        }
        return switch (rest.charAt(0)) {
            case PathSyntax.SEPARATOR -> resolveAt(element, rest.substring(1), depth + 1);
            case PathSyntax.OPEN -> resolveAt(element, rest, depth + 1);
            default -> null;
        };
    }

    private Schema dictionaryDescent(Schema shape, String key, int depth) {
        if (!(shape instanceof DictionarySchema dictionary)) {
            return null;
        }
        final int dot = key.indexOf(PathSyntax.SEPARATOR);
        if (dot <= 0 || !PathSyntax.isBareKey(key.substring(0, dot))) {
            return null;
        }
        return resolveAt(dictionary.value(), key.substring(dot + 1), depth + 1);
    }

    private Schema optionalChain(Schema shape, String key, int depth) {
        for (int dot = key.lastIndexOf(PathSyntax.SEPARATOR); dot > 0; dot = key.lastIndexOf(PathSyntax.SEPARATOR, dot - 1)) {
            final var member = PrecedencePolicy.member(shape, key.substring(0, dot));
            if (member == null || !PrecedencePolicy.isOptional(graph, member)) {
                continue;
            }
            final var result = resolveAt(member.schema(), key.substring(dot + 1), depth + 1);
            if (result != null) {
                return result;
            }
        }
        return null;
    }
}
