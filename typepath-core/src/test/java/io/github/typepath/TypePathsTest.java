package io.github.typepath;

import org.junit.jupiter.api.Test;

import static io.github.typepath.Schema.arrayOf;
import static io.github.typepath.Schema.number;
import static io.github.typepath.Schema.object;
import static io.github.typepath.Schema.string;
import static io.github.typepath.Schema.union;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// End-to-end behaviour of the facade: enumeration and resolution agreeing on the same schemas.
class TypePathsTest extends TypePathTestBase {

    @Test
    void everyEnumeratedPatternResolves() {
        final Schema[] schemas = {
                TestSchemas.SIMPLE, TestSchemas.NESTED, TestSchemas.ORDER, TestSchemas.OPTIONAL,
                TestSchemas.UNION, TestSchemas.INTERSECTION, TestSchemas.MATRICES, TestSchemas.RECORDS,
                TestSchemas.DEEP, TestSchemas.COMPLEX_UNION, TestSchemas.TUPLES, TestSchemas.TERMINALS,
                TestSchemas.NULLABLE, TestSchemas.AMBIGUOUS, TestSchemas.DICTIONARY, TestSchemas.EDGE_CASES,
                arrayOf(arrayOf(TestSchemas.ITEM))
        };
        for (final var schema : schemas) {
            final var graph = SchemaGraph.of(schema);
            for (final var pattern : TypePaths.enumeratePaths(graph)) {
                assertThat(TestSchemas.resolvesForSomeIndex(graph, pattern)).as("%s from %s", pattern, schema).isTrue();
            }
        }
    }

    @Test
    void everyEnumeratedPatternResolvesInRecursiveGraphs() {
        for (final var graph : new SchemaGraph[]{TestSchemas.CIRCULAR, TestSchemas.RECURSIVE}) {
            for (final var pattern : TypePaths.enumeratePaths(graph)) {
                assertThat(TestSchemas.resolvesForSomeIndex(graph, pattern)).as(pattern.text()).isTrue();
            }
        }
    }

    @Test
    void arrayChaining() {
        assertThat(TypePaths.resolve(TestSchemas.ORDER, "items[0].tags[1]"))
                .isEqualTo(new Resolution.Resolved("items[0].tags[1]", string()));
        assertThat(TypePaths.enumeratePaths(TestSchemas.ORDER)).extracting(PathPattern::text)
                .contains("items", "items[*]", "items[*].id", "items[*].tags", "items[*].tags[*]");
    }

    @Test
    void tupleSlotsShareOneWildcard() {
        final var schema = object().required("pair", Schema.tupleOf(string(), object().required("x", number()).build())).build();

        assertThat(TypePaths.enumeratePaths(schema)).extracting(PathPattern::text)
                .containsExactlyInAnyOrder("pair", "pair[*]", "pair[*].x");
        assertThat(TypePaths.resolve(schema, "pair[0]").toOptional()).contains(string());
        assertThat(TypePaths.resolve(schema, "pair[1].x").toOptional()).contains(number());
        assertThat(TypePaths.isValid(SchemaGraph.of(schema), "pair[0].x")).isFalse();
        assertThat(TypePaths.isValid(SchemaGraph.of(schema), "pair[2]")).isFalse();
    }

    @Test
    void indexChainsKeepTheBudgetOfTheirField() {
        final var items = object().required("items", arrayOf(object().required("id", number()).build())).build();
        assertThat(TypePaths.enumeratePaths(SchemaGraph.of(items), 1)).extracting(PathPattern::text)
                .containsExactlyInAnyOrder("items", "items[*]", "items[*].id");

        final var deep = object().required("a", object().required("b", object().required("c", object()
                .required("d", object().required("tags", arrayOf(string())).build())
                .build()).build()).build()).build();
        assertThat(TypePaths.enumeratePaths(deep)).extracting(PathPattern::text)
                .containsExactlyInAnyOrder("a", "a.b", "a.b.c", "a.b.c.d", "a.b.c.d.tags", "a.b.c.d.tags[*]");
        assertThat(TypePaths.resolve(deep, "a.b.c.d.tags[0]").toOptional()).contains(string());
    }

    @Test
    void optionalUnwrap() {
        final var schema = object().optional("opt", object().required("prop", string()).build()).build();

        assertThat(TypePaths.resolve(schema, "opt.prop").toOptional()).contains(string());
        assertThat(TypePaths.enumeratePaths(schema)).extracting(PathPattern::text).contains("opt", "opt.prop");
    }

    @Test
    void unionDistribution() {
        final var element = union(object().required("id", number()).build(), object().required("code", string()).build());
        final var graph = SchemaGraph.of(arrayOf(element));

        assertThat(TypePaths.resolve(graph, "[0].id").toOptional()).contains(number());
        assertThat(TypePaths.resolve(graph, "[0].code").toOptional()).contains(string());
    }

    @Test
    void explicitKeyPrecedence() {
        assertThat(TypePaths.resolve(TestSchemas.AMBIGUOUS, "a.b").toOptional())
                .contains(object().required("c", number()).build());
        assertThat(TypePaths.resolve(TestSchemas.AMBIGUOUS, "a.b.c").toOptional()).contains(number());
    }

    @Test
    void schemaOverloadsRejectReferences() {
        final var schema = object().required("next", Schema.ref("Node")).build();

        assertThatThrownBy(() -> TypePaths.enumeratePaths(schema)).isInstanceOf(SchemaDefinitionException.class);
        assertThatThrownBy(() -> TypePaths.resolve(schema, "next")).isInstanceOf(SchemaDefinitionException.class);
    }

    @Test
    void nullArgumentsAreRejected() {
        final var graph = SchemaGraph.of(TestSchemas.SIMPLE);

        assertThatThrownBy(() -> TypePaths.resolve(graph, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("path must not be null");
        assertThatThrownBy(() -> TypePaths.enumeratePaths(graph, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("options must not be null");
        assertThatThrownBy(() -> TypePaths.explain(null, "name"))
                .isInstanceOf(NullPointerException.class);
    }
}
