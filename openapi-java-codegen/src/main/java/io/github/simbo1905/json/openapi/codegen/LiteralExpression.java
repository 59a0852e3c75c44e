package io.github.simbo1905.json.openapi.codegen;

import java.util.Objects;

/// A rendered default value in Java source form.
public sealed interface LiteralExpression
        permits LiteralExpression.Constant, LiteralExpression.Construct, LiteralExpression.EnumConstant,
        LiteralExpression.EmptyCollection, LiteralExpression.Placeholder {

    /// Java source text of the expression.
    String source();

    /// A compile-time constant: boolean, numeric or string literal.
    record Constant(String source) implements LiteralExpression {
        public Constant {
            Objects.requireNonNull(source, "source must not be null");
        }
    }

    /// A parse or constructor call over a raw string, e.g. `UUID.fromString("...")`.
    record Construct(String source) implements LiteralExpression {
        public Construct {
            Objects.requireNonNull(source, "source must not be null");
        }
    }

    record EnumConstant(String enumName, String memberName) implements LiteralExpression {
        public EnumConstant {
            Objects.requireNonNull(enumName, "enumName must not be null");
            Objects.requireNonNull(memberName, "memberName must not be null");
        }

        @Override
        public String source() {
            return enumName + "." + memberName;
        }
    }

    record EmptyCollection(ResolvedType.Mutability mutability) implements LiteralExpression {
        @Override
        public String source() {
            return mutability == ResolvedType.Mutability.MUTABLE ? "new java.util.ArrayList<>()" : "java.util.List.of()";
        }
    }

    /// Stands in for a default that is not propagated; emitters suppress null warnings on it.
    record Placeholder() implements LiteralExpression {
        @Override
        public String source() {
            return "null";
        }
    }
}
