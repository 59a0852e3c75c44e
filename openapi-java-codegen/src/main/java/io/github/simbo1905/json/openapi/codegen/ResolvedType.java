package io.github.simbo1905.json.openapi.codegen;

import java.util.Objects;

/// A target type reference produced by [TypeResolver]. Values are created fresh per
/// resolution call and never shared as mutable state.
public sealed interface ResolvedType
        permits ResolvedType.Primitive, ResolvedType.CollectionType, ResolvedType.MapType,
        ResolvedType.NamedReference, ResolvedType.NullableWrapper {

    /// Primitive and formatted scalar kinds. `OBJECT` is the opaque fallback.
    enum PrimitiveKind {
        STRING("String", "String"),
        BOOLEAN("boolean", "Boolean"),
        INT32("int", "Integer"),
        INT64("long", "Long"),
        FLOAT32("float", "Float"),
        FLOAT64("double", "Double"),
        DECIMAL("java.math.BigDecimal", "java.math.BigDecimal"),
        DATE_TIME("java.time.OffsetDateTime", "java.time.OffsetDateTime"),
        DATE("java.time.LocalDate", "java.time.LocalDate"),
        TIME("java.time.LocalTime", "java.time.LocalTime"),
        DURATION("java.time.Duration", "java.time.Duration"),
        UUID("java.util.UUID", "java.util.UUID"),
        URI("java.net.URI", "java.net.URI"),
        BYTES("byte[]", "byte[]"),
        BINARY("java.io.InputStream", "java.io.InputStream"),
        OBJECT("Object", "Object");

        private final String javaType;
        private final String boxedType;

        PrimitiveKind(String javaType, String boxedType) {
            this.javaType = javaType;
            this.boxedType = boxedType;
        }

        public String javaType() {
            return javaType;
        }

        public String boxedType() {
            return boxedType;
        }

        /// Formatted kinds whose string defaults render as parse/construct expressions.
        public boolean isFormattedString() {
            return switch (this) {
                case DATE_TIME, DATE, TIME, DURATION, UUID, URI -> true;
                default -> false;
            };
        }
    }

    enum Mutability {
        IMMUTABLE, MUTABLE
    }

    record Primitive(PrimitiveKind kind) implements ResolvedType {
        public Primitive {
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }

    record CollectionType(ResolvedType element, Mutability mutability) implements ResolvedType {
        public CollectionType {
            Objects.requireNonNull(element, "element must not be null");
            Objects.requireNonNull(mutability, "mutability must not be null");
        }
    }

    record MapType(ResolvedType valueType, Mutability mutability) implements ResolvedType {
        public MapType {
            Objects.requireNonNull(valueType, "valueType must not be null");
            Objects.requireNonNull(mutability, "mutability must not be null");
        }
    }

    record NamedReference(String declarationName) implements ResolvedType {
        public NamedReference {
            Objects.requireNonNull(declarationName, "declarationName must not be null");
        }
    }

    record NullableWrapper(ResolvedType inner) implements ResolvedType {
        public NullableWrapper {
            Objects.requireNonNull(inner, "inner must not be null");
            if (inner instanceof NullableWrapper) {
                throw new IllegalArgumentException("nullable wrappers do not nest");
            }
        }
    }

    static ResolvedType opaque() {
        return new Primitive(PrimitiveKind.OBJECT);
    }

    static ResolvedType nullable(ResolvedType type) {
        return type instanceof NullableWrapper ? type : new NullableWrapper(type);
    }

    /// Strips a nullable wrapper, if present.
    default ResolvedType unwrapped() {
        return this instanceof NullableWrapper n ? n.inner() : this;
    }

    default boolean isNullable() {
        return this instanceof NullableWrapper;
    }
}
