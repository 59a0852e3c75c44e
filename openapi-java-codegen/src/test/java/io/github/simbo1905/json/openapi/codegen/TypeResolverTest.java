package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.ResolvedType.CollectionType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.MapType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.Mutability;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.NamedReference;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.NullableWrapper;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.Primitive;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.PrimitiveKind;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.JsonType;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaNode;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.simbo1905.json.openapi.codegen.SchemaAst.builder;
import static io.github.simbo1905.json.openapi.codegen.SchemaAst.ref;
import static org.assertj.core.api.Assertions.assertThat;

class TypeResolverTest extends CodegenTestBase {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<SchemaNode, String> inline = new IdentityHashMap<>();
    private final TypeResolver.NameLookup lookup = new TypeResolver.NameLookup() {
        @Override
        public Optional<String> declarationName(String schemaId) {
            return Optional.ofNullable(Map.of("Pet", "Pet", "pet_status", "PetStatus", "Shape", "Shape").get(schemaId));
        }

        @Override
        public Optional<String> inlineDeclaration(SchemaNode node) {
            return Optional.ofNullable(inline.get(node));
        }

        @Override
        public boolean isUntaggedUnion(String schemaId) {
            return "Shape".equals(schemaId);
        }
    };

    private TypeResolver resolver(CodegenOptions options) {
        return new TypeResolver(options, lookup, diagnostics::add);
    }

    private final TypeResolver resolver = resolver(CodegenOptions.defaults());

    private static Primitive primitive(PrimitiveKind kind) {
        return new Primitive(kind);
    }

    @Test
    void stringFormats() {
        assertThat(resolver.resolve("T", string(), true)).isEqualTo(primitive(PrimitiveKind.STRING));
        assertThat(resolver.resolve("T", builder(JsonType.STRING).format("date-time").build(), true))
                .isEqualTo(primitive(PrimitiveKind.DATE_TIME));
        assertThat(resolver.resolve("T", builder(JsonType.STRING).format("uuid").build(), true))
                .isEqualTo(primitive(PrimitiveKind.UUID));
        assertThat(resolver.resolve("T", builder(JsonType.STRING).format("byte").build(), true))
                .isEqualTo(primitive(PrimitiveKind.BYTES));
        assertThat(resolver.resolve("T", builder(JsonType.STRING).format("email").build(), true))
                .isEqualTo(primitive(PrimitiveKind.STRING));
    }

    @Test
    void numericFormats() {
        assertThat(resolver.resolve("T", integer(), true)).isEqualTo(primitive(PrimitiveKind.INT32));
        assertThat(resolver.resolve("T", builder(JsonType.INTEGER).format("int64").build(), true))
                .isEqualTo(primitive(PrimitiveKind.INT64));
        assertThat(resolver.resolve("T", builder(JsonType.NUMBER).build(), true))
                .isEqualTo(primitive(PrimitiveKind.FLOAT64));
        assertThat(resolver.resolve("T", builder(JsonType.NUMBER).format("float").build(), true))
                .isEqualTo(primitive(PrimitiveKind.FLOAT32));
        assertThat(resolver.resolve("T", builder(JsonType.NUMBER).format("decimal").build(), true))
                .isEqualTo(primitive(PrimitiveKind.DECIMAL));
        assertThat(resolver.resolve("T", builder(JsonType.BOOLEAN).build(), true))
                .isEqualTo(primitive(PrimitiveKind.BOOLEAN));
    }

    @Test
    void referencesResolveToDeclarationNames() {
        assertThat(resolver.resolve("T", ref("pet_status"), true)).isEqualTo(new NamedReference("PetStatus"));
        assertThat(resolver.resolve("T", builder().allOf(ref("Pet")).build(), true))
                .isEqualTo(new NamedReference("Pet"));
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void unknownReferenceDegradesToObject() {
        assertThat(resolver.resolve("Owner", ref("Missing"), true)).isEqualTo(ResolvedType.opaque());
        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(Diagnostic.Kind.UNRESOLVED_REFERENCE);
            assertThat(d.schemaName()).isEqualTo("Owner");
        });
    }

    @Test
    void untaggedUnionReferenceIsOpaque() {
        assertThat(resolver.resolve("T", ref("Shape"), true)).isEqualTo(ResolvedType.opaque());
    }

    @Test
    void optionalMembersAreNullable() {
        assertThat(resolver.resolve("T", string(), false)).isEqualTo(new NullableWrapper(primitive(PrimitiveKind.STRING)));
        assertThat(resolver.resolve("T", ref("Pet"), false)).isEqualTo(new NullableWrapper(new NamedReference("Pet")));
        assertThat(resolver.resolve("T", builder(JsonType.STRING, JsonType.NULL).build(), true))
                .isEqualTo(new NullableWrapper(primitive(PrimitiveKind.STRING)));
    }

    @Test
    void defaultSatisfiesRequiredOnlyWhenEnabled() {
        final var withDefault = builder(JsonType.INTEGER).defaultValue(SchemaValue.of(3)).build();
        final var nullDefault = builder(JsonType.INTEGER).defaultValue(new SchemaAst.NullValue()).build();

        assertThat(resolver.resolve("T", withDefault, false)).isEqualTo(primitive(PrimitiveKind.INT32));
        assertThat(resolver.resolve("T", nullDefault, false).isNullable()).isTrue();
        assertThat(resolver(CodegenOptions.defaults().withDefaultSatisfiesRequired(false))
                .resolve("T", withDefault, false).isNullable()).isTrue();
    }

    @Test
    void defaultWithoutLiteralFormDoesNotSatisfyRequired() {
        final var bytes = builder(JsonType.STRING).format("byte").defaultValue(SchemaValue.of("AAEC")).build();
        final var mistyped = builder(JsonType.INTEGER).defaultValue(SchemaValue.of("three")).build();
        final var tooWide = builder(JsonType.INTEGER).format("int32").defaultValue(SchemaValue.of(1L << 40)).build();

        assertThat(resolver.resolve("T", bytes, false)).isEqualTo(new NullableWrapper(primitive(PrimitiveKind.BYTES)));
        assertThat(resolver.resolve("T", mistyped, false).isNullable()).isTrue();
        assertThat(resolver.resolve("T", tooWide, false).isNullable()).isTrue();
    }

    @Test
    void anyOfWithNullIsNullableMember() {
        final var node = builder().anyOf(ref("Pet"), builder(JsonType.NULL).build()).build();

        assertThat(resolver.resolve("T", node, true)).isEqualTo(new NullableWrapper(new NamedReference("Pet")));
    }

    @Test
    void compositionFallbacks() {
        assertThat(resolver.resolve("T", builder().oneOf(ref("Pet")).build(), true)).isEqualTo(new NamedReference("Pet"));
        assertThat(resolver.resolve("T", builder().oneOf(ref("Pet"), string()).build(), true))
                .isEqualTo(ResolvedType.opaque());
    }

    @Test
    void discriminatedInlineUnionUsesItsDeclaration() {
        final var node = builder().oneOf(ref("Pet"), ref("pet_status"))
                .discriminator("kind", Map.of()).build();
        inline.put(node, "PetOrStatus");

        assertThat(resolver.resolve("T", node, true)).isEqualTo(new NamedReference("PetOrStatus"));
    }

    @Test
    void arraysAndMaps() {
        final var array = builder(JsonType.ARRAY).items(string()).build();
        final var untypedArray = builder(JsonType.ARRAY).build();
        final var map = builder(JsonType.OBJECT).additionalProperties(integer()).build();

        assertThat(resolver.resolve("T", array, true))
                .isEqualTo(new CollectionType(primitive(PrimitiveKind.STRING), Mutability.IMMUTABLE));
        assertThat(resolver.resolve("T", untypedArray, true))
                .isEqualTo(new CollectionType(ResolvedType.opaque(), Mutability.IMMUTABLE));
        assertThat(resolver.resolve("T", map, true))
                .isEqualTo(new MapType(primitive(PrimitiveKind.INT32), Mutability.IMMUTABLE));

        final var mutable = resolver(CodegenOptions.defaults().withMutableCollections(true, false));
        assertThat(mutable.resolve("T", array, true))
                .isEqualTo(new CollectionType(primitive(PrimitiveKind.STRING), Mutability.MUTABLE));
        assertThat(mutable.resolve("T", map, true))
                .isEqualTo(new MapType(primitive(PrimitiveKind.INT32), Mutability.IMMUTABLE));
    }

    @Test
    void objectsAndEnumsNeedSynthesisContext() {
        final var object = builder(JsonType.OBJECT).property("x", string()).build();
        final var inlineEnum = stringEnum("a", "b");

        assertThat(resolver.resolve("T", object, true)).isEqualTo(ResolvedType.opaque());
        assertThat(resolver.resolve("T", inlineEnum, true)).isEqualTo(primitive(PrimitiveKind.STRING));

        inline.put(object, "TX");
        inline.put(inlineEnum, "X");
        assertThat(resolver.resolve("T", object, true)).isEqualTo(new NamedReference("TX"));
        assertThat(resolver.resolve("T", inlineEnum, true)).isEqualTo(new NamedReference("X"));
    }

    @Test
    void nestingBeyondTheLimitIsOpaque() {
        final var shallow = resolver(CodegenOptions.defaults().withMaxCompositionDepth(2));
        SchemaNode node = string();
        for (int i = 0; i < 4; i++) {
            node = builder(JsonType.ARRAY).items(node).build();
        }

        final var resolved = shallow.resolveUnderlying("Deep", node);

        final var expected = new CollectionType(new CollectionType(new CollectionType(ResolvedType.opaque(),
                Mutability.IMMUTABLE), Mutability.IMMUTABLE), Mutability.IMMUTABLE);
        assertThat(resolved).isEqualTo(expected);
        assertThat(diagnostics).extracting(Diagnostic::kind).containsExactly(Diagnostic.Kind.DEPTH_EXCEEDED);
    }
}
