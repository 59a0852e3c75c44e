package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.SchemaAst.IntegerValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.JsonType;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.NullValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaNode;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaRef;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.StringValue;

import java.util.ArrayList;
import java.util.List;

/// Shape predicates shared by the synthesis passes.
final class SchemaShapes {
    private SchemaShapes() {}

    /// Enum literals without `null`, which only marks the enumeration nullable.
    static List<SchemaValue> enumLiterals(SchemaNode node) {
        return node.enumValues().stream().filter(v -> !(v instanceof NullValue)).toList();
    }

    /// A string or integer node with at least one enum literal.
    static boolean isEnumeration(SchemaNode node) {
        final var literals = enumLiterals(node);
        if (literals.isEmpty()) {
            return false;
        }
        final var base = TypeResolver.effectiveType(node);
        if (base.isPresent() && base.get() != JsonType.STRING && base.get() != JsonType.INTEGER) {
            return false;
        }
        if (base.isEmpty() && node.types().stream().anyMatch(t -> t != JsonType.NULL)) {
            return false;
        }
        if (base.isPresent() && base.get() == JsonType.INTEGER) {
            return literals.stream().allMatch(IntegerValue.class::isInstance);
        }
        return literals.stream().allMatch(v -> v instanceof StringValue || v instanceof IntegerValue);
    }

    static Declaration.EnumBase enumBase(SchemaNode node) {
        return !node.hasType(JsonType.STRING)
                && enumLiterals(node).stream().allMatch(IntegerValue.class::isInstance)
                ? Declaration.EnumBase.INTEGER
                : Declaration.EnumBase.STRING;
    }

    static List<Schema> alternatives(SchemaNode node) {
        return !node.oneOf().isEmpty() ? node.oneOf() : node.anyOf();
    }

    /// Two or more alternatives that are not just `X or null`.
    static boolean isUnion(SchemaNode node) {
        final var alternatives = alternatives(node);
        if (alternatives.size() < 2) {
            return false;
        }
        final long nonNull = alternatives.stream()
                .filter(s -> !(s instanceof SchemaNode n && n.isNullOnly()))
                .count();
        return nonNull >= 2;
    }

    /// An object with own or `allOf`-merged properties. A bare map (only
    /// `additionalProperties`) is not an aggregate.
    static boolean isAggregate(SchemaNode node) {
        if (isEnumeration(node) || isUnion(node)) {
            return false;
        }
        if (node.hasProperties() || !node.allOf().isEmpty()) {
            return true;
        }
        return node.baseType().filter(t -> t == JsonType.OBJECT).isPresent()
                && node.additionalProperties() == null
                && alternatives(node).isEmpty();
    }

    /// An inline object that gets its own aggregate declaration. Inline objects that
    /// compose references are resolved through the reference instead.
    static boolean isInlineAggregate(SchemaNode node) {
        return node.hasProperties()
                && node.allOf().isEmpty()
                && alternatives(node).isEmpty()
                && !isEnumeration(node)
                && TypeResolver.effectiveType(node).filter(t -> t == JsonType.OBJECT).isPresent();
    }

    /// The inline (non-reference) `allOf` parts, in order.
    static List<SchemaNode> inlineParts(SchemaNode node) {
        final var parts = new ArrayList<SchemaNode>();
        for (var s : node.allOf()) {
            if (s instanceof SchemaNode n) parts.add(n);
        }
        return parts;
    }

    static List<SchemaRef> referenceParts(SchemaNode node) {
        final var refs = new ArrayList<SchemaRef>();
        for (var s : node.allOf()) {
            if (s instanceof SchemaRef r) refs.add(r);
        }
        return refs;
    }
}
