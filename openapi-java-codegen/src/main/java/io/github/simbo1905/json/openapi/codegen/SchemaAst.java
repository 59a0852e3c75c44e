package io.github.simbo1905.json.openapi.codegen;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// In-memory schema graph consumed by the declaration engine.
/// Covers the part of OpenAPI 3.x `components/schemas` that affects type synthesis:
/// type flags, formats, enums, properties, composition, discriminators and defaults.
///
/// Nodes are immutable once built. Collections keep their insertion order because
/// declaration order and collision tie-breaking depend on it.
public final class SchemaAst {
    private SchemaAst() {}

    /// A schema position: either an inline node or a reference to a named schema.
    public sealed interface Schema permits SchemaNode, SchemaRef {}

    /// Reference to a top-level schema by its raw name.
    public record SchemaRef(String id) implements Schema {
        public SchemaRef {
            Objects.requireNonNull(id, "id must not be null");
        }
    }

    /// JSON type flags. `NULL` combines with the others to express nullability.
    public enum JsonType {
        STRING, INTEGER, NUMBER, BOOLEAN, ARRAY, OBJECT, NULL
    }

    /// Discriminator property plus the literal-value to schema mapping.
    public record Discriminator(String propertyName, Map<String, SchemaRef> mapping) {
        public Discriminator {
            Objects.requireNonNull(propertyName, "propertyName must not be null");
            mapping = ordered(mapping);
        }
    }

    public record SchemaNode(
            Set<JsonType> types,
            String format,
            List<SchemaValue> enumValues,
            Set<String> required,
            Map<String, Schema> properties,
            Schema items,
            Schema additionalProperties,
            List<Schema> allOf,
            List<Schema> oneOf,
            List<Schema> anyOf,
            Discriminator discriminator,
            SchemaValue defaultValue,
            String description
    ) implements Schema {
        public SchemaNode {
            final var flags = EnumSet.noneOf(JsonType.class);
            if (types != null) flags.addAll(types);
            types = Collections.unmodifiableSet(flags);
            enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
            required = required == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(required));
            properties = ordered(properties);
            allOf = allOf == null ? List.of() : List.copyOf(allOf);
            oneOf = oneOf == null ? List.of() : List.copyOf(oneOf);
            anyOf = anyOf == null ? List.of() : List.copyOf(anyOf);
        }

        public boolean hasType(JsonType type) {
            return types.contains(type);
        }

        public boolean isNullable() {
            return types.contains(JsonType.NULL);
        }

        /// The single non-null type flag, if there is exactly one.
        public Optional<JsonType> baseType() {
            JsonType found = null;
            for (var t : types) {
                if (t == JsonType.NULL) continue;
                if (found != null) return Optional.empty();
                found = t;
            }
            return Optional.ofNullable(found);
        }

        /// A null-only node, as used in `anyOf: [X, {type: null}]`.
        public boolean isNullOnly() {
            return types.size() == 1 && types.contains(JsonType.NULL)
                    && allOf.isEmpty() && oneOf.isEmpty() && anyOf.isEmpty() && properties.isEmpty();
        }

        public boolean hasEnum() {
            return !enumValues.isEmpty();
        }

        public boolean hasProperties() {
            return !properties.isEmpty();
        }
    }

    /// Typed literal used for defaults and enum values.
    public sealed interface SchemaValue
            permits BooleanValue, IntegerValue, NumberValue, StringValue, ArrayValue, ObjectValue, NullValue {

        /// The value as it would be written in the source document, used for enum matching.
        String literalText();

        static SchemaValue of(String value) {
            return new StringValue(value);
        }

        static SchemaValue of(long value) {
            return new IntegerValue(BigInteger.valueOf(value));
        }

        static SchemaValue of(boolean value) {
            return new BooleanValue(value);
        }

        static SchemaValue of(BigDecimal value) {
            return new NumberValue(value);
        }
    }

    public record BooleanValue(boolean value) implements SchemaValue {
        @Override
        public String literalText() {
            return Boolean.toString(value);
        }
    }

    public record IntegerValue(BigInteger value) implements SchemaValue {
        public IntegerValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String literalText() {
            return value.toString();
        }
    }

    public record NumberValue(BigDecimal value) implements SchemaValue {
        public NumberValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String literalText() {
            return value.toPlainString();
        }
    }

    public record StringValue(String value) implements SchemaValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String literalText() {
            return value;
        }
    }

    public record ArrayValue(List<SchemaValue> elements) implements SchemaValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String literalText() {
            return elements.toString();
        }
    }

    public record ObjectValue(Map<String, SchemaValue> members) implements SchemaValue {
        public ObjectValue {
            members = ordered(members);
        }

        @Override
        public String literalText() {
            return members.toString();
        }
    }

    public record NullValue() implements SchemaValue {
        @Override
        public String literalText() {
            return "null";
        }
    }

    public static SchemaRef ref(String id) {
        return new SchemaRef(id);
    }

    public static Builder builder(JsonType... types) {
        return new Builder().type(types);
    }

    /// Mutable builder for [SchemaNode]; used by the document reader and by tests.
    public static final class Builder {
        private final Set<JsonType> types = EnumSet.noneOf(JsonType.class);
        private String format;
        private final List<SchemaValue> enumValues = new ArrayList<>();
        private final Set<String> required = new LinkedHashSet<>();
        private final Map<String, Schema> properties = new LinkedHashMap<>();
        private Schema items;
        private Schema additionalProperties;
        private final List<Schema> allOf = new ArrayList<>();
        private final List<Schema> oneOf = new ArrayList<>();
        private final List<Schema> anyOf = new ArrayList<>();
        private Discriminator discriminator;
        private SchemaValue defaultValue;
        private String description;

        private Builder() {}

        public Builder type(JsonType... flags) {
            types.addAll(Arrays.asList(flags));
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder enumValues(Collection<SchemaValue> values) {
            enumValues.addAll(values);
            return this;
        }

        public Builder enumStrings(String... values) {
            for (var v : values) enumValues.add(new StringValue(v));
            return this;
        }

        public Builder required(String... names) {
            required.addAll(Arrays.asList(names));
            return this;
        }

        public Builder property(String name, Schema schema) {
            properties.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(schema, "schema"));
            return this;
        }

        public Builder items(Schema items) {
            this.items = items;
            return this;
        }

        public Builder additionalProperties(Schema additionalProperties) {
            this.additionalProperties = additionalProperties;
            return this;
        }

        public Builder allOf(Schema... parts) {
            allOf.addAll(Arrays.asList(parts));
            return this;
        }

        public Builder oneOf(Schema... parts) {
            oneOf.addAll(Arrays.asList(parts));
            return this;
        }

        public Builder anyOf(Schema... parts) {
            anyOf.addAll(Arrays.asList(parts));
            return this;
        }

        public Builder discriminator(String propertyName, Map<String, SchemaRef> mapping) {
            this.discriminator = new Discriminator(propertyName, mapping);
            return this;
        }

        public Builder defaultValue(SchemaValue defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public SchemaNode build() {
            return new SchemaNode(types, format, enumValues, required, properties, items, additionalProperties,
                    allOf, oneOf, anyOf, discriminator, defaultValue, description);
        }
    }

    private static <K, V> Map<K, V> ordered(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
