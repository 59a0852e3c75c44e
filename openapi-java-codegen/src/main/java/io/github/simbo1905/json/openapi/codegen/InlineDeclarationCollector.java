package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaNode;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// First-pass walk that finds the inline nodes needing their own declaration:
/// enumerations, grouped by `(property name, literal set)`, and inline objects.
///
/// Nodes are tracked by identity; two structurally equal nodes at different positions
/// still belong to the group of their property.
final class InlineDeclarationCollector {

    /// All inline enumeration nodes sharing a property name and literal set. Members
    /// keep the order of the first node seen.
    record EnumGroup(String propertyName, List<SchemaValue> literals, List<SchemaNode> nodes) {
        EnumGroup {
            literals = List.copyOf(literals);
        }

        SchemaNode first() {
            return nodes.get(0);
        }
    }

    /// An inline object; `rawName` is the owner's raw name followed by the property name.
    record InlineObject(String rawName, SchemaNode node) {}

    private record GroupKey(String propertyName, Set<String> literals) {}

    private final Map<GroupKey, EnumGroup> groups = new LinkedHashMap<>();
    private final List<InlineObject> objects = new ArrayList<>();
    private final Set<SchemaNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());

    /// Walks the properties of one aggregate, including its inline `allOf` parts.
    void collectAggregate(String ownerRaw, SchemaNode node) {
        properties(ownerRaw, node);
        for (var part : SchemaShapes.inlineParts(node)) {
            properties(ownerRaw, part);
        }
    }

    /// Walks the element and value positions of a top-level alias such as an array schema.
    void collectAlias(String ownerRaw, SchemaNode node) {
        if (node.items() != null) visit(ownerRaw, "item", node.items());
        if (node.additionalProperties() != null) visit(ownerRaw, "value", node.additionalProperties());
    }

    List<EnumGroup> enumGroups() {
        return List.copyOf(groups.values());
    }

    List<InlineObject> inlineObjects() {
        return List.copyOf(objects);
    }

    private void properties(String ownerRaw, SchemaNode node) {
        node.properties().forEach((name, schema) -> visit(ownerRaw, name, schema));
        if (node.additionalProperties() != null) {
            visit(ownerRaw, "additionalProperties", node.additionalProperties());
        }
    }

    private void visit(String ownerRaw, String propertyName, Schema schema) {
        if (!(schema instanceof SchemaNode node) || !visited.add(node)) {
            return;
        }
        if (SchemaShapes.isEnumeration(node)) {
            final var literals = SchemaShapes.enumLiterals(node);
            final var key = new GroupKey(propertyName,
                    literals.stream().map(v -> v.getClass().getSimpleName() + ":" + v.literalText())
                            .collect(Collectors.toCollection(TreeSet::new)));
            groups.computeIfAbsent(key, k -> new EnumGroup(propertyName, literals, new ArrayList<>()))
                    .nodes().add(node);
            StructuredLog.finer(LOG, "collect.inlineEnum", "owner", ownerRaw, "property", propertyName,
                    "values", literals.size());
            return;
        }
        if (SchemaShapes.isInlineAggregate(node)) {
            final String raw = ownerRaw + " " + propertyName;
            objects.add(new InlineObject(raw, node));
            StructuredLog.finer(LOG, "collect.inlineObject", "raw", raw);
            properties(raw, node);
            return;
        }
        if (node.items() != null) visit(ownerRaw, propertyName, node.items());
        if (node.additionalProperties() != null) visit(ownerRaw, propertyName, node.additionalProperties());
        // only `X or null` alternatives resolve through their member
        if (!SchemaShapes.isUnion(node)) {
            for (var s : SchemaShapes.alternatives(node)) visit(ownerRaw, propertyName, s);
        }
    }
}
