package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// One synthesized, uniquely named declaration. The set is closed: consumers switch on
/// [#kind()] and every variant must be handled.
public sealed interface Declaration
        permits Declaration.Aggregate, Declaration.Enumeration, Declaration.Union, Declaration.TypeAlias {

    enum Kind {
        AGGREGATE, ENUMERATION, UNION, TYPE_ALIAS
    }

    String name();

    Kind kind();

    /// Schema description, or null.
    String description();

    /// A member of an aggregate. `jsonName` is the original schema key, kept for
    /// serialization fidelity.
    record Member(String name, ResolvedType type, boolean mandatory, LiteralExpression defaultValue,
                  String jsonName, String description) {
        public Member {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(jsonName, "jsonName must not be null");
        }

        public Optional<LiteralExpression> defaultExpression() {
            return Optional.ofNullable(defaultValue);
        }
    }

    /// Catch-all member collecting keys the aggregate does not model.
    record ExtensionData(String name, ResolvedType valueType) {
        public ExtensionData {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(valueType, "valueType must not be null");
        }
    }

    record Aggregate(String name, String baseName, List<Member> members, ExtensionData extensionData,
                     String description) implements Declaration {
        public Aggregate {
            Objects.requireNonNull(name, "name must not be null");
            members = List.copyOf(members);
        }

        public Optional<String> base() {
            return Optional.ofNullable(baseName);
        }

        public Optional<ExtensionData> extension() {
            return Optional.ofNullable(extensionData);
        }

        public Optional<Member> member(String memberName) {
            return members.stream().filter(m -> m.name().equals(memberName)).findFirst();
        }

        @Override
        public Kind kind() {
            return Kind.AGGREGATE;
        }
    }

    enum EnumBase {
        STRING, INTEGER
    }

    record EnumMember(String name, SchemaValue value) {
        public EnumMember {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Enumeration(String name, EnumBase base, List<EnumMember> members, String description)
            implements Declaration {
        public Enumeration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(base, "base must not be null");
            members = List.copyOf(members);
            if (members.isEmpty()) {
                throw new IllegalArgumentException("enumeration " + name + " must have at least one member");
            }
        }

        /// Finds the member whose original literal matches `value`.
        public Optional<EnumMember> memberFor(SchemaValue value) {
            final var text = value.literalText();
            return members.stream().filter(m -> m.value().literalText().equals(text)).findFirst();
        }

        @Override
        public Kind kind() {
            return Kind.ENUMERATION;
        }
    }

    /// A union variant; `discriminatorValue` is null when no tag literal is known.
    /// `aliasValues` holds further mapping literals that select the same variant.
    record UnionVariant(String declarationName, String discriminatorValue, List<String> aliasValues) {
        public UnionVariant {
            Objects.requireNonNull(declarationName, "declarationName must not be null");
            aliasValues = List.copyOf(aliasValues);
        }

        public UnionVariant(String declarationName, String discriminatorValue) {
            this(declarationName, discriminatorValue, List.of());
        }

        UnionVariant withAlias(String value) {
            final var values = new ArrayList<>(aliasValues);
            values.add(value);
            return new UnionVariant(declarationName, discriminatorValue, values);
        }
    }

    record Union(String name, boolean open, String discriminatorProperty, List<UnionVariant> variants,
                 String description) implements Declaration {
        public Union {
            Objects.requireNonNull(name, "name must not be null");
            variants = List.copyOf(variants);
        }

        public Optional<String> discriminator() {
            return Optional.ofNullable(discriminatorProperty);
        }

        @Override
        public Kind kind() {
            return Kind.UNION;
        }
    }

    record TypeAlias(String name, ResolvedType underlying, String description) implements Declaration {
        public TypeAlias {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(underlying, "underlying must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.TYPE_ALIAS;
        }
    }
}
