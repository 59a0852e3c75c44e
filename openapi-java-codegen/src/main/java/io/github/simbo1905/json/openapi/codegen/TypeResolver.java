package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.ResolvedType.CollectionType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.MapType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.NamedReference;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.Primitive;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.PrimitiveKind;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.JsonType;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.NullValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaNode;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaRef;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Maps schema positions to [ResolvedType] values.
///
/// The resolver holds no state between calls apart from the read-only name lookup;
/// problems are reported to the diagnostic sink and degrade to the opaque type.
public final class TypeResolver {

    /// Read-only view of the names the synthesizer has allocated.
    public interface NameLookup {
        /// Declaration name for a top-level schema id, or empty when the id is unknown.
        Optional<String> declarationName(String schemaId);

        /// Declaration synthesized for an inline node (an inline enumeration), or empty.
        Optional<String> inlineDeclaration(SchemaNode node);

        /// Whether the top-level schema is a union without a discriminator. Such unions
        /// have no faithful Java type, so references to them resolve as `Object`.
        boolean isUntaggedUnion(String schemaId);

        /// Enumeration declaration with the given name, used to render enum defaults.
        default Optional<Declaration.Enumeration> enumeration(String declarationName) {
            return Optional.empty();
        }
    }

    private final CodegenOptions options;
    private final NameLookup lookup;
    private final Consumer<Diagnostic> diagnostics;
    private final LiteralRenderer literals;

    public TypeResolver(CodegenOptions options, NameLookup lookup, Consumer<Diagnostic> diagnostics) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.literals = new LiteralRenderer(lookup::enumeration);
    }

    /// Resolves a member position. `required` is whether the owning object lists the member
    /// as required; it drives nullability together with the node's own `null` flag.
    public ResolvedType resolve(String owner, Schema schema, boolean required) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        final ResolvedType type = resolveAt(owner, schema, 0);
        if (schema instanceof SchemaNode node) {
            if (node.isNullable()
                    || !required && !(options.defaultSatisfiesRequired() && hasRenderableDefault(node, type))) {
                return ResolvedType.nullable(type);
            }
            return type;
        }
        return required ? type : ResolvedType.nullable(type);
    }

    /// Resolves a schema without member context: only the node's own `null` flag makes it nullable.
    public ResolvedType resolveUnderlying(String owner, Schema schema) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        return resolveAt(owner, schema, 0);
    }

    private ResolvedType resolveAt(String owner, Schema schema, int depth) {
        if (depth > options.maxCompositionDepth()) {
            report(new Diagnostic(Diagnostic.Kind.DEPTH_EXCEEDED, owner,
                    "nesting deeper than " + options.maxCompositionDepth() + " resolved as Object"));
            return ResolvedType.opaque();
        }
        if (schema instanceof SchemaRef ref) {
            return resolveReference(owner, ref);
        }
        final var node = (SchemaNode) schema;
        final ResolvedType type = resolveNode(owner, node, depth);
        if (node.isNullable() && !node.isNullOnly()) {
            return ResolvedType.nullable(type);
        }
        return type;
    }

    private ResolvedType resolveReference(String owner, SchemaRef ref) {
        if (lookup.isUntaggedUnion(ref.id())) {
            StructuredLog.finer(LOG, "resolve.opaqueUnion", "owner", owner, "ref", ref.id());
            return ResolvedType.opaque();
        }
        final var name = lookup.declarationName(ref.id());
        if (name.isPresent()) {
            return new NamedReference(name.get());
        }
        report(new Diagnostic(Diagnostic.Kind.UNRESOLVED_REFERENCE, owner,
                "reference to unknown schema '" + ref.id() + "' resolved as Object"));
        return ResolvedType.opaque();
    }

    private ResolvedType resolveNode(String owner, SchemaNode node, int depth) {
        // allOf with a single reference component is transparent
        final var allOfRefs = node.allOf().stream().filter(SchemaRef.class::isInstance).toList();
        if (allOfRefs.size() == 1) {
            return resolveAt(owner, allOfRefs.get(0), depth + 1);
        }

        final List<Schema> alternatives = !node.oneOf().isEmpty() ? node.oneOf() : node.anyOf();
        if (!alternatives.isEmpty()) {
            return resolveAlternatives(owner, node, alternatives, depth);
        }

        if (node.hasEnum()) {
            final var enumName = lookup.inlineDeclaration(node);
            if (enumName.isPresent()) {
                return new NamedReference(enumName.get());
            }
        }

        final var base = effectiveType(node);
        if (base.isEmpty()) {
            return ResolvedType.opaque();
        }
        switch (base.get()) {
            case STRING:
                return new Primitive(stringKind(node.format()));
            case INTEGER:
                return new Primitive("int64".equals(node.format()) ? PrimitiveKind.INT64 : PrimitiveKind.INT32);
            case NUMBER:
                return new Primitive(numberKind(node.format()));
            case BOOLEAN:
                return new Primitive(PrimitiveKind.BOOLEAN);
            case ARRAY: {
                final ResolvedType element = node.items() == null
                        ? ResolvedType.opaque()
                        : resolveAt(owner, node.items(), depth + 1);
                return new CollectionType(element, options.arrayMutability());
            }
            case OBJECT: {
                final var inline = lookup.inlineDeclaration(node);
                if (inline.isPresent()) {
                    return new NamedReference(inline.get());
                }
                if (node.additionalProperties() != null && !node.hasProperties()) {
                    return new MapType(resolveAt(owner, node.additionalProperties(), depth + 1),
                            options.mapMutability());
                }
                // aggregate identity needs synthesis context
                return ResolvedType.opaque();
            }
            default:
                return ResolvedType.opaque();
        }
    }

    private ResolvedType resolveAlternatives(String owner, SchemaNode node, List<Schema> alternatives, int depth) {
        if (alternatives.size() == 1) {
            return resolveAt(owner, alternatives.get(0), depth + 1);
        }
        final var nonNull = alternatives.stream().filter(s -> !isNullOnly(s)).toList();
        if (nonNull.size() == 1) {
            return ResolvedType.nullable(resolveAt(owner, nonNull.get(0), depth + 1));
        }
        if (node.discriminator() != null) {
            final var union = lookup.inlineDeclaration(node);
            if (union.isPresent()) {
                return new NamedReference(union.get());
            }
        }
        StructuredLog.finer(LOG, "resolve.opaqueUnion", "owner", owner, "alternatives", alternatives.size());
        return ResolvedType.opaque();
    }

    /// The node's single non-null type flag, inferred from its shape when no flag is declared.
    static Optional<JsonType> effectiveType(SchemaNode node) {
        final var declared = node.baseType();
        if (declared.isPresent()) {
            return declared;
        }
        if (node.types().stream().anyMatch(t -> t != JsonType.NULL)) {
            // several non-null flags: no single Java type
            return Optional.empty();
        }
        if (node.hasProperties() || node.additionalProperties() != null) {
            return Optional.of(JsonType.OBJECT);
        }
        if (node.items() != null) {
            return Optional.of(JsonType.ARRAY);
        }
        return Optional.empty();
    }

    static PrimitiveKind stringKind(String format) {
        if (format == null) {
            return PrimitiveKind.STRING;
        }
        return switch (format) {
            case "date-time" -> PrimitiveKind.DATE_TIME;
            case "date" -> PrimitiveKind.DATE;
            case "time" -> PrimitiveKind.TIME;
            case "duration" -> PrimitiveKind.DURATION;
            case "uuid" -> PrimitiveKind.UUID;
            case "uri" -> PrimitiveKind.URI;
            case "byte" -> PrimitiveKind.BYTES;
            case "binary" -> PrimitiveKind.BINARY;
            default -> PrimitiveKind.STRING;
        };
    }

    static PrimitiveKind numberKind(String format) {
        if (format == null) {
            return PrimitiveKind.FLOAT64;
        }
        return switch (format) {
            case "float" -> PrimitiveKind.FLOAT32;
            case "decimal" -> PrimitiveKind.DECIMAL;
            default -> PrimitiveKind.FLOAT64;
        };
    }

    private static boolean isNullOnly(Schema schema) {
        return schema instanceof SchemaNode n && n.isNullOnly();
    }

    /// A default only stands in for `required` when it becomes an initializer.
    private boolean hasRenderableDefault(SchemaNode node, ResolvedType type) {
        if (node.defaultValue() == null || node.defaultValue() instanceof NullValue) {
            return false;
        }
        return literals.render(node.defaultValue(), type, node.format()).isPresent();
    }

    private void report(Diagnostic diagnostic) {
        StructuredLog.warning(LOG, "diagnostic", "kind", diagnostic.kind(), "schema", diagnostic.schemaName(),
                "message", diagnostic.message());
        diagnostics.accept(diagnostic);
    }
}
