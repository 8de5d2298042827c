package io.github.typepath;

import static io.github.typepath.Schema.arrayOf;
import static io.github.typepath.Schema.bool;
import static io.github.typepath.Schema.dictionaryOf;
import static io.github.typepath.Schema.nullValue;
import static io.github.typepath.Schema.number;
import static io.github.typepath.Schema.object;
import static io.github.typepath.Schema.optional;
import static io.github.typepath.Schema.ref;
import static io.github.typepath.Schema.string;
import static io.github.typepath.Schema.terminal;
import static io.github.typepath.Schema.timestamp;
import static io.github.typepath.Schema.tupleOf;
import static io.github.typepath.Schema.union;

/// Shared schemas for enumeration and resolution tests.
final class TestSchemas {

    private TestSchemas() {}

    static final Schema.ObjectSchema SIMPLE = object()
            .required("name", string())
            .required("age", number())
            .required("123", string())
            .build();

    static final Schema.ObjectSchema NESTED = object()
            .required("user", object()
                    .required("profile", object()
                            .required("firstName", string())
                            .required("lastName", string())
                            .build())
                    .required("settings", object()
                            .required("theme", string())
                            .build())
                    .build())
            .required("metadata", object()
                    .required("createdAt", timestamp())
                    .build())
            .build();

    /// `{items: {id: number, tags: string[]}[]}`
    static final Schema.ObjectSchema ORDER = object()
            .required("items", arrayOf(object()
                    .required("id", number())
                    .required("tags", arrayOf(string()))
                    .build()))
            .build();

    static final Schema.ObjectSchema OPTIONAL = object()
            .required("required", string())
            .optional("optional", object()
                    .required("value", string())
                    .optional("nested", object()
                            .required("deep", number())
                            .build())
                    .build())
            .build();

    static final Schema.ObjectSchema UNION = object()
            .required("status", string())
            .required("data", union(
                    object()
                            .required("type", string())
                            .required("permissions", arrayOf(string()))
                            .build(),
                    object()
                            .required("type", string())
                            .required("expiresAt", timestamp())
                            .build()))
            .build();

    static final Schema.ObjectSchema BASE = object()
            .required("id", number())
            .required("created", timestamp())
            .build();

    static final Schema.ObjectSchema EXTRA = object()
            .required("metadata", object()
                    .required("tags", arrayOf(string()))
                    .build())
            .build();

    static final Schema.ObjectSchema INTERSECTION = object().include(BASE).include(EXTRA).build();

    private static final Schema CELL = union(number(), string());

    static final Schema.ObjectSchema MATRICES = object()
            .required("matrixtwo", arrayOf(arrayOf(CELL)))
            .required("matrixthree", arrayOf(arrayOf(arrayOf(CELL))))
            .required("mixed", arrayOf(union(string(), object()
                    .required("id", number())
                    .required("value", string())
                    .build())))
            .build();

    static final Schema.ObjectSchema RECORDS = object()
            .required("users", dictionaryOf(object()
                    .required("name", string())
                    .required("role", string())
                    .build()))
            .required("settings", dictionaryOf(bool()))
            .build();

    static final Schema.ObjectSchema DEEP = object()
            .required("a", object()
                    .required("b", object()
                            .required("c", object()
                                    .required("d", object()
                                            .required("e", object()
                                                    .required("f", string())
                                                    .build())
                                            .build())
                                    .build())
                            .build())
                    .build())
            .build();

    /// `Node = {name: string, child?: Node}`
    static final SchemaGraph CIRCULAR = SchemaGraph.builder()
            .define("Node", object()
                    .required("name", string())
                    .optional("child", ref("Node"))
                    .build())
            .root(ref("Node"))
            .build();

    /// `Tree = {name: string, children?: Tree[]}`
    static final SchemaGraph RECURSIVE = SchemaGraph.builder()
            .define("Tree", object()
                    .required("name", string())
                    .optional("children", arrayOf(ref("Tree")))
                    .build())
            .root(ref("Tree"))
            .build();

    static final Schema COMPLEX_UNION = union(
            object().required("type", string()).required("value", string()).build(),
            object().required("type", string()).required("values", arrayOf(string())).build(),
            object().required("type", string()).required("nested", object().required("value", number()).build()).build());

    static final Schema.ObjectSchema TUPLES = object()
            .required("coordinates", tupleOf(number(), number()))
            .required("range", tupleOf(timestamp(), timestamp()))
            .required("mixed", tupleOf(string(), object().required("x", number()).build(), arrayOf(number())))
            .build();

    static final Schema.ObjectSchema TERMINALS = object()
            .required("date", timestamp())
            .required("regex", terminal(TerminalKind.PATTERN))
            .required("func", terminal(TerminalKind.FUNCTION))
            .required("promise", terminal(TerminalKind.PROMISE))
            .build();

    static final Schema.ObjectSchema NULLABLE = object()
            .required("nullable", optional(nullValue()))
            .optional("optNull", nullValue())
            .required("strict", nullValue())
            .build();

    /// `{"a.b": {c: number}, a: {b: {c: string}}}`
    static final Schema.ObjectSchema AMBIGUOUS = object()
            .required("a.b", object().required("c", number()).build())
            .required("a", object()
                    .required("b", object().required("c", string()).build())
                    .build())
            .build();

    /// `{[key]: {inner: string, arrayInner: boolean[]}}`
    static final Schema.DictionarySchema DICTIONARY = dictionaryOf(object()
            .required("inner", string())
            .required("arrayInner", arrayOf(bool()))
            .build());

    static final Schema.ObjectSchema EDGE_CASES = object()
            .optional("nullableOptional", union(string(), nullValue()))
            .optional("multiOptional", object()
                    .optional("nested", object()
                            .optional("value", string())
                            .build())
                    .build())
            .optional("optionalArray", arrayOf(string()))
            .optional("optionalDeepArray", arrayOf(object().required("value", string()).build()))
            .optional("recursiveArray", arrayOf(arrayOf(string())))
            .optional("optionalDictionary", dictionaryOf(number()))
            .build();

    /// `Item = {id: number, name: string, tags: string[]}`
    static final Schema.ObjectSchema ITEM = object()
            .required("id", number())
            .required("name", string())
            .required("tags", arrayOf(string()))
            .build();

    /// Indices tried for each `[*]`; no fixture or generated tuple has more slots.
    static final int MAX_SLOTS = 3;

    /// True if some choice of indices below [#MAX_SLOTS] for the pattern's `[*]`
    /// placeholders gives a path that resolves. Tuple slots each have their own shape,
    /// so only the matching index is expected to work; any index works for an array.
    static boolean resolvesForSomeIndex(SchemaGraph graph, PathPattern pattern) {
        return resolvesForSomeIndex(graph, pattern, PathOptions.DEFAULT);
    }

    static boolean resolvesForSomeIndex(SchemaGraph graph, PathPattern pattern, PathOptions options) {
        return resolvesFrom(graph, options, pattern.text(), 0);
    }

    private static boolean resolves(SchemaGraph graph, PathOptions options, String text) {
        return TypePaths.resolve(graph, new PathPattern(text).instantiate(0, "key"), options).isResolved();
    }

    private static boolean resolvesFrom(SchemaGraph graph, PathOptions options, String text, int from) {
        final int at = text.indexOf("[*]", from);
        if (at < 0) {
            return resolves(graph, options, text);
        }
        for (int i = 0; i < MAX_SLOTS; i++) {
            final var bracket = "[" + i + "]";
            final var candidate = text.substring(0, at) + bracket + text.substring(at + 3);
            final var prefix = candidate.substring(0, at + bracket.length());
            if (resolves(graph, options, prefix) && resolvesFrom(graph, options, candidate, at + bracket.length())) {
                return true;
            }
        }
        return false;
    }
}
