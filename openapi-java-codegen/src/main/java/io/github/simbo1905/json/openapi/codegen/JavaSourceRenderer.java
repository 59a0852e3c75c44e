package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.Declaration.Aggregate;
import io.github.simbo1905.json.openapi.codegen.Declaration.Enumeration;
import io.github.simbo1905.json.openapi.codegen.Declaration.Member;
import io.github.simbo1905.json.openapi.codegen.Declaration.TypeAlias;
import io.github.simbo1905.json.openapi.codegen.Declaration.Union;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.CollectionType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.MapType;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.NamedReference;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.NullableWrapper;
import io.github.simbo1905.json.openapi.codegen.ResolvedType.Primitive;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Renders a declaration set as Java sources, one compilation unit per declaration.
///
/// Aggregates become mutable classes with Jackson-annotated fields, enumerations become
/// enums carrying their original literal, unions become interfaces implemented by their
/// variants, and aliases become single-component records.
public final class JavaSourceRenderer {
    private JavaSourceRenderer() {}

    private static final String JACKSON = "com.fasterxml.jackson.annotation.";
    private static final String INDENT = "    ";

    /// @return file name (`Name.java`) to source text, in declaration order
    public static Map<String, String> render(GenerationResult result, CodegenOptions options) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(options, "options must not be null");

        final var ctx = new RenderContext(options, result);
        final Map<String, String> out = new LinkedHashMap<>();
        for (var declaration : result.declarations()) {
            out.put(declaration.name() + ".java", renderDeclaration(declaration, ctx));
        }
        StructuredLog.fine(LOG, "render.done", "files", out.size(), "package", options.packageName());
        return out;
    }

    static String renderDeclaration(Declaration declaration, RenderContext ctx) {
        ctx.imports.clear();
        final var body = new StringBuilder(2 * 1024);
        switch (declaration.kind()) {
            case AGGREGATE -> renderAggregate(body, (Aggregate) declaration, ctx);
            case ENUMERATION -> renderEnumeration(body, (Enumeration) declaration, ctx);
            case UNION -> renderUnion(body, (Union) declaration, ctx);
            case TYPE_ALIAS -> renderAlias(body, (TypeAlias) declaration, ctx);
        }

        final var sb = new StringBuilder(body.length() + 512);
        if (ctx.options.fileHeader()) {
            sb.append("// Generated by openapi-java-codegen from schema '").append(declaration.name())
                    .append("'. Do not edit.\n\n");
        }
        sb.append("package ").append(ctx.options.packageName()).append(";\n\n");
        if (!ctx.imports.isEmpty()) {
            for (var imp : ctx.imports) {
                sb.append("import ").append(imp).append(";\n");
            }
            sb.append('\n');
        }
        return sb.append(body).toString();
    }

    // ------------------------------------------------------------------
    // Aggregates
    // ------------------------------------------------------------------

    private static void renderAggregate(StringBuilder sb, Aggregate aggregate, RenderContext ctx) {
        javadoc(sb, "", aggregate.description(), ctx);
        final String autoDetect = ctx.annotation("JsonAutoDetect");
        sb.append('@').append(autoDetect).append("(fieldVisibility = ").append(autoDetect)
                .append(".Visibility.NONE, getterVisibility = ").append(autoDetect)
                .append(".Visibility.NONE,\n").append(INDENT).append(INDENT)
                .append("isGetterVisibility = ").append(autoDetect)
                .append(".Visibility.NONE, setterVisibility = ").append(autoDetect).append(".Visibility.NONE)\n");
        sb.append("public class ").append(aggregate.name());
        aggregate.base().ifPresent(base -> sb.append(" extends ").append(base));
        implementsClause(sb, "implements", aggregate.name(), ctx);
        sb.append(" {\n");

        for (var member : aggregate.members()) {
            javadoc(sb, INDENT, member.description(), ctx);
            sb.append(INDENT).append('@').append(ctx.annotation("JsonProperty")).append('(');
            if (member.mandatory()) {
                sb.append("value = ").append(LiteralRenderer.quote(member.jsonName())).append(", required = true");
            } else {
                sb.append(LiteralRenderer.quote(member.jsonName()));
            }
            sb.append(")\n");
            sb.append(INDENT).append("private ").append(memberType(member, ctx)).append(' ').append(member.name());
            member.defaultExpression().ifPresent(d -> sb.append(" = ").append(initializer(d, ctx)));
            sb.append(";\n\n");
        }

        aggregate.extension().ifPresent(ext -> {
            final String valueType = ctx.typeName(ext.valueType(), true);
            sb.append(INDENT).append("private final java.util.Map<").append(ctx.lang("String")).append(", ")
                    .append(valueType).append("> ").append(ext.name()).append(" = new java.util.LinkedHashMap<>();\n\n");
        });

        for (var member : aggregate.members()) {
            final String type = memberType(member, ctx);
            final String suffix = accessorSuffix(member.name());
            sb.append(INDENT).append("public ").append(type).append(" get").append(suffix).append("() {\n");
            sb.append(INDENT).append(INDENT).append("return ").append(member.name()).append(";\n");
            sb.append(INDENT).append("}\n\n");
            sb.append(INDENT).append("public void set").append(suffix).append('(').append(type).append(" value) {\n");
            sb.append(INDENT).append(INDENT).append("this.").append(member.name()).append(" = value;\n");
            sb.append(INDENT).append("}\n\n");
        }

        aggregate.extension().ifPresent(ext -> {
            final String valueType = ctx.typeName(ext.valueType(), true);
            final String suffix = accessorSuffix(ext.name());
            sb.append(INDENT).append('@').append(ctx.annotation("JsonAnyGetter")).append('\n');
            sb.append(INDENT).append("public java.util.Map<").append(ctx.lang("String")).append(", ")
                    .append(valueType).append("> get").append(suffix).append("() {\n");
            sb.append(INDENT).append(INDENT).append("return ").append(ext.name()).append(";\n");
            sb.append(INDENT).append("}\n\n");
            sb.append(INDENT).append('@').append(ctx.annotation("JsonAnySetter")).append('\n');
            sb.append(INDENT).append("public void put").append(suffix).append('(').append(ctx.lang("String"))
                    .append(" key, ").append(valueType).append(" value) {\n");
            sb.append(INDENT).append(INDENT).append(ext.name()).append(".put(key, value);\n");
            sb.append(INDENT).append("}\n\n");
        });

        trimTrailingBlankLine(sb);
        sb.append("}\n");
    }

    /// Placeholder defaults are `null`, so they force the boxed form.
    private static String memberType(Member member, RenderContext ctx) {
        final boolean boxed = member.type().isNullable()
                || member.defaultValue() instanceof LiteralExpression.Placeholder;
        return ctx.typeName(member.type(), boxed);
    }

    /// Enum constants are package-qualified: a PascalCase field named after its enum type
    /// would otherwise capture the simple name in its own initializer.
    private static String initializer(LiteralExpression expression, RenderContext ctx) {
        return expression instanceof LiteralExpression.EnumConstant
                ? ctx.options.packageName() + "." + expression.source()
                : expression.source();
    }

    static String accessorSuffix(String memberName) {
        final String suffix = Character.toUpperCase(memberName.charAt(0)) + memberName.substring(1);
        // getClass() is final on Object
        return "Class".equals(suffix) ? "Class_" : suffix;
    }

    // ------------------------------------------------------------------
    // Enumerations
    // ------------------------------------------------------------------

    private static void renderEnumeration(StringBuilder sb, Enumeration enumeration, RenderContext ctx) {
        final boolean integer = enumeration.base() == Declaration.EnumBase.INTEGER;
        final String valueType = integer ? "long" : ctx.lang("String");

        javadoc(sb, "", enumeration.description(), ctx);
        sb.append("public enum ").append(enumeration.name());
        implementsClause(sb, "implements", enumeration.name(), ctx);
        sb.append(" {\n");
        final var members = enumeration.members();
        for (int i = 0; i < members.size(); i++) {
            final var m = members.get(i);
            final String literal = integer
                    ? m.value().literalText() + "L"
                    : LiteralRenderer.quote(m.value().literalText());
            sb.append(INDENT).append(m.name()).append('(').append(literal).append(')')
                    .append(i + 1 < members.size() ? ",\n" : ";\n\n");
        }

        sb.append(INDENT).append("private final ").append(valueType).append(" value;\n\n");
        sb.append(INDENT).append(enumeration.name()).append('(').append(valueType).append(" value) {\n");
        sb.append(INDENT).append(INDENT).append("this.value = value;\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append('@').append(ctx.annotation("JsonValue")).append('\n');
        sb.append(INDENT).append("public ").append(valueType).append(" value() {\n");
        sb.append(INDENT).append(INDENT).append("return value;\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append('@').append(ctx.annotation("JsonCreator")).append('\n');
        sb.append(INDENT).append("public static ").append(enumeration.name()).append(" fromValue(")
                .append(valueType).append(" value) {\n");
        sb.append(INDENT).append(INDENT).append("for (").append(enumeration.name()).append(" candidate : values()) {\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append("if (")
                .append(integer ? "candidate.value == value" : "candidate.value.equals(value)").append(") {\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append(INDENT).append("return candidate;\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append("}\n");
        sb.append(INDENT).append(INDENT).append("}\n");
        sb.append(INDENT).append(INDENT).append("throw new ").append(ctx.lang("IllegalArgumentException")).append("(\"Unknown ")
                .append(enumeration.name()).append(" value: \" + value);\n");
        sb.append(INDENT).append("}\n");
        sb.append("}\n");
    }

    // ------------------------------------------------------------------
    // Unions and aliases
    // ------------------------------------------------------------------

    private static void renderUnion(StringBuilder sb, Union union, RenderContext ctx) {
        final var description = new StringBuilder(union.description() == null ? "" : union.description());
        if (union.open()) {
            if (description.length() > 0) description.append("\n\n");
            description.append("Untagged union of ")
                    .append(union.variants().stream().map(Declaration.UnionVariant::declarationName)
                            .collect(Collectors.joining(", ")))
                    .append(". Members typed by this union are declared as Object.");
        }
        javadoc(sb, "", description.length() == 0 ? null : description.toString(), ctx);

        if (union.discriminator().isPresent()) {
            final String typeInfo = ctx.annotation("JsonTypeInfo");
            sb.append('@').append(typeInfo).append("(use = ").append(typeInfo).append(".Id.NAME, include = ")
                    .append(typeInfo).append(".As.EXISTING_PROPERTY,\n").append(INDENT).append(INDENT)
                    .append("property = ").append(LiteralRenderer.quote(union.discriminator().get()))
                    .append(", visible = true)\n");
            final String subTypes = ctx.annotation("JsonSubTypes");
            sb.append('@').append(subTypes).append("({\n");
            final var variants = union.variants();
            for (int i = 0; i < variants.size(); i++) {
                final var v = variants.get(i);
                sb.append(INDENT).append('@').append(subTypes).append(".Type(value = ")
                        .append(v.declarationName()).append(".class");
                if (v.discriminatorValue() != null) {
                    sb.append(", name = ").append(LiteralRenderer.quote(v.discriminatorValue()));
                }
                if (!v.aliasValues().isEmpty()) {
                    sb.append(", names = {").append(v.aliasValues().stream().map(LiteralRenderer::quote)
                            .collect(Collectors.joining(", "))).append('}');
                }
                sb.append(')').append(i + 1 < variants.size() ? ",\n" : "\n");
            }
            sb.append("})\n");
        }
        sb.append("public interface ").append(union.name());
        implementsClause(sb, "extends", union.name(), ctx);
        sb.append(" {\n}\n");
    }

    private static void renderAlias(StringBuilder sb, TypeAlias alias, RenderContext ctx) {
        final String type = ctx.typeName(alias.underlying(), alias.underlying().isNullable());
        javadoc(sb, "", alias.description(), ctx);
        sb.append("public record ").append(alias.name()).append('(').append(type).append(" value)");
        implementsClause(sb, "implements", alias.name(), ctx);
        sb.append(" {\n");
        sb.append(INDENT).append('@').append(ctx.annotation("JsonCreator")).append("(mode = ")
                .append(ctx.annotation("JsonCreator")).append(".Mode.DELEGATING)\n");
        sb.append(INDENT).append("public ").append(alias.name()).append(" {\n");
        sb.append(INDENT).append("}\n\n");
        sb.append(INDENT).append('@').append(ctx.annotation("JsonValue")).append('\n');
        sb.append(INDENT).append('@').append(ctx.lang("Override")).append('\n');
        sb.append(INDENT).append("public ").append(type).append(" value() {\n");
        sb.append(INDENT).append(INDENT).append("return value;\n");
        sb.append(INDENT).append("}\n");
        sb.append("}\n");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void implementsClause(StringBuilder sb, String keyword, String name, RenderContext ctx) {
        final var unions = ctx.unionsOf.getOrDefault(name, List.of());
        if (!unions.isEmpty()) {
            sb.append(' ').append(keyword).append(' ').append(String.join(", ", unions));
        }
    }

    private static void javadoc(StringBuilder sb, String indent, String text, RenderContext ctx) {
        if (!ctx.options.docComments() || text == null || text.isBlank()) {
            return;
        }
        final String safe = text.strip().replace("*/", "*&#47;");
        sb.append(indent).append("/**\n");
        for (var line : safe.split("\\R", -1)) {
            sb.append(indent).append(" *");
            if (!line.isBlank()) sb.append(' ').append(line.stripTrailing());
            sb.append('\n');
        }
        sb.append(indent).append(" */\n");
    }

    private static void trimTrailingBlankLine(StringBuilder sb) {
        if (sb.length() >= 2 && sb.charAt(sb.length() - 1) == '\n' && sb.charAt(sb.length() - 2) == '\n') {
            sb.setLength(sb.length() - 1);
        }
    }

    /// Per-run rendering state. Simple names that a declaration shadows are written fully qualified.
    static final class RenderContext {
        final CodegenOptions options;
        final Set<String> declaredNames;
        final Map<String, List<String>> unionsOf = new LinkedHashMap<>();
        final Set<String> imports = new TreeSet<>();

        RenderContext(CodegenOptions options, GenerationResult result) {
            this.options = options;
            this.declaredNames = result.kinds().keySet();
            for (var d : result.declarations()) {
                if (d instanceof Union u) {
                    for (var v : u.variants()) {
                        if (v.declarationName().equals(u.name())) continue;
                        unionsOf.computeIfAbsent(v.declarationName(), k -> new ArrayList<>()).add(u.name());
                    }
                }
            }
        }

        String annotation(String simpleName) {
            if (declaredNames.contains(simpleName)) {
                return JACKSON + simpleName;
            }
            imports.add(JACKSON + simpleName);
            return simpleName;
        }

        String lang(String simpleName) {
            return declaredNames.contains(simpleName) ? "java.lang." + simpleName : simpleName;
        }

        String typeName(ResolvedType type, boolean boxed) {
            if (type instanceof NullableWrapper n) {
                return typeName(n.inner(), true);
            }
            if (type instanceof Primitive p) {
                final String name = boxed ? p.kind().boxedType() : p.kind().javaType();
                return name.indexOf('.') >= 0 || name.endsWith("[]") || Character.isLowerCase(name.charAt(0))
                        ? name
                        : lang(name);
            }
            if (type instanceof CollectionType c) {
                return "java.util.List<" + typeName(c.element(), true) + ">";
            }
            if (type instanceof MapType m) {
                return "java.util.Map<" + lang("String") + ", " + typeName(m.valueType(), true) + ">";
            }
            return ((NamedReference) type).declarationName();
        }
    }
}
