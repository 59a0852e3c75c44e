package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.Declaration.Enumeration;
import io.github.simbo1905.json.openapi.codegen.LiteralExpression.Constant;
import io.github.simbo1905.json.openapi.codegen.LiteralExpression.Construct;
import io.github.simbo1905.json.openapi.codegen.LiteralExpression.EmptyCollection;
import io.github.simbo1905.json.openapi.codegen.LiteralExpression.EnumConstant;
import io.github.simbo1905.json.openapi.codegen.LiteralExpression.Placeholder;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.CollectionType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.NamedReference;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.Primitive;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.PrimitiveKind;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.ArrayValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.BooleanValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.IntegerValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.NumberValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.StringValue;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Turns schema default values into Java expressions.
///
/// A default that cannot be written as a faithful Java expression renders as empty
/// and the member simply gets no initializer.
public final class LiteralRenderer {

    /// String formats the resolver maps to a dedicated Java type, plus the ones it knowingly leaves as `String`.
    static final Set<String> KNOWN_STRING_FORMATS = Set.of(
            "date-time", "date", "time", "duration", "uuid", "uri", "byte", "binary", "password");

    private final Function<String, Optional<Enumeration>> enumerations;

    /// @param enumerations finds an enumeration declaration by name
    public LiteralRenderer(Function<String, Optional<Enumeration>> enumerations) {
        this.enumerations = Objects.requireNonNull(enumerations, "enumerations must not be null");
    }

    /// Renders `value` for a member of type `type`. `format` is the schema format, used to
    /// spot string defaults whose format has no Java mapping.
    public Optional<LiteralExpression> render(SchemaValue value, ResolvedType type, String format) {
        if (value == null) {
            return Optional.empty();
        }
        Objects.requireNonNull(type, "type must not be null");
        final ResolvedType target = type.unwrapped();
        final Optional<LiteralExpression> out;
        if (target instanceof Primitive p) {
            out = renderPrimitive(value, p.kind(), format);
        } else if (target instanceof NamedReference ref) {
            out = enumerations.apply(ref.declarationName())
                    .flatMap(e -> e.memberFor(value).map(m -> (LiteralExpression) new EnumConstant(e.name(), m.name())));
        } else if (target instanceof CollectionType c) {
            out = value instanceof ArrayValue a && a.elements().isEmpty()
                    ? Optional.of(new EmptyCollection(c.mutability()))
                    : Optional.empty();
        } else {
            out = Optional.empty();
        }
        if (out.isEmpty()) {
            StructuredLog.finer(LOG, "literal.absent", "value", value.literalText(), "type", target);
        }
        return out;
    }

    private Optional<LiteralExpression> renderPrimitive(SchemaValue value, PrimitiveKind kind, String format) {
        switch (kind) {
            case BOOLEAN:
                return value instanceof BooleanValue b
                        ? Optional.of(new Constant(Boolean.toString(b.value())))
                        : Optional.empty();
            case INT32:
                return value instanceof IntegerValue i && i.value().bitLength() < 32
                        ? Optional.of(new Constant(i.value().toString()))
                        : Optional.empty();
            case INT64:
                return value instanceof IntegerValue i && i.value().bitLength() < 64
                        ? Optional.of(new Constant(i.value().toString() + "L"))
                        : Optional.empty();
            case FLOAT32:
                return numeric(value)
                        .filter(d -> representable(d.floatValue(), d))
                        .map(d -> new Constant(d.toPlainString() + "f"));
            case FLOAT64:
                return numeric(value)
                        .filter(d -> representable(d.doubleValue(), d))
                        .map(d -> new Constant(d.toPlainString() + "d"));
            case DECIMAL:
                return numeric(value)
                        .map(d -> new Construct("new java.math.BigDecimal(" + quote(d.toPlainString()) + ")"));
            case STRING:
                if (!(value instanceof StringValue s)) {
                    return Optional.empty();
                }
                if (format != null && !KNOWN_STRING_FORMATS.contains(format)) {
                    return Optional.of(new Placeholder());
                }
                return Optional.of(new Constant(quote(s.value())));
            case DATE_TIME:
                return construct(value, "java.time.OffsetDateTime.parse(");
            case DATE:
                return construct(value, "java.time.LocalDate.parse(");
            case TIME:
                return construct(value, "java.time.LocalTime.parse(");
            case DURATION:
                return construct(value, "java.time.Duration.parse(");
            case UUID:
                return construct(value, "java.util.UUID.fromString(");
            case URI:
                return construct(value, "java.net.URI.create(");
            default:
                // bytes, binary streams and opaque objects have no literal form
                return Optional.empty();
        }
    }

    private static Optional<LiteralExpression> construct(SchemaValue value, String call) {
        return value instanceof StringValue s
                ? Optional.of(new Construct(call + quote(s.value()) + ")"))
                : Optional.empty();
    }

    private static Optional<BigDecimal> numeric(SchemaValue value) {
        if (value instanceof IntegerValue i) {
            return Optional.of(new BigDecimal(i.value()));
        }
        if (value instanceof NumberValue n) {
            return Optional.of(n.value());
        }
        return Optional.empty();
    }

    /// javac rejects literals that overflow to infinity or underflow to zero.
    private static boolean representable(double converted, BigDecimal original) {
        if (Double.isInfinite(converted)) {
            return false;
        }
        return converted != 0.0d || original.signum() == 0;
    }

    /// Java string literal for `s`. Control characters use octal escapes because
    /// unicode escapes are translated before the literal is lexed.
    static String quote(String s) {
        final var sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
