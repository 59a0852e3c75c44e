package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaNode;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Single-inheritance edges between top-level aggregates.
///
/// The base of an aggregate is its first `allOf` reference naming another aggregate.
/// Chains are followed with an explicit path stack; an edge that would close a cycle,
/// or extend a chain past the depth limit, is dropped and reported. The surviving
/// graph is acyclic.
final class InheritanceGraph {

    private final Map<String, Schema> schemas;
    private final int maxDepth;
    private final Consumer<Diagnostic> diagnostics;
    private final Map<String, Optional<String>> bases = new HashMap<>();
    private final Map<String, String> droppedCycleEdges = new HashMap<>();

    InheritanceGraph(Map<String, Schema> schemas, int maxDepth, Consumer<Diagnostic> diagnostics) {
        this.schemas = schemas;
        this.maxDepth = maxDepth;
        this.diagnostics = diagnostics;
    }

    /// Raw id of the base aggregate of `id`, after cycle breaking.
    Optional<String> baseOf(String id) {
        resolve(id, new ArrayDeque<>());
        return bases.getOrDefault(id, Optional.empty());
    }

    /// Raw ids of all ancestors of `id`, nearest first.
    List<String> ancestors(String id) {
        final var chain = new ArrayList<String>();
        var current = baseOf(id);
        while (current.isPresent()) {
            chain.add(current.get());
            current = baseOf(current.get());
        }
        return chain;
    }

    /// `allOf` references of `id` other than the base edge and a dropped cycle-closing edge, in order.
    List<SchemaRef> flattenedReferences(String id) {
        final var out = new ArrayList<SchemaRef>();
        if (!(schemas.get(id) instanceof SchemaNode node)) {
            return out;
        }
        final var base = baseOf(id);
        final String dropped = droppedCycleEdges.get(id);
        boolean baseSeen = false;
        for (var ref : SchemaShapes.referenceParts(node)) {
            if (!baseSeen && base.isPresent() && ref.id().equals(base.get())) {
                baseSeen = true;
                continue;
            }
            if (ref.id().equals(dropped)) {
                continue;
            }
            out.add(ref);
        }
        return out;
    }

    private void resolve(String id, Deque<String> path) {
        if (bases.containsKey(id)) {
            return;
        }
        path.push(id);
        String base = candidate(id);
        if (base != null) {
            if (path.contains(base)) {
                report(new Diagnostic(Diagnostic.Kind.COMPOSITION_CYCLE, id,
                        "base '" + base + "' closes the cycle " + describe(path, base) + "; inheritance edge dropped"));
                droppedCycleEdges.put(id, base);
                base = null;
            } else if (path.size() > maxDepth) {
                report(new Diagnostic(Diagnostic.Kind.DEPTH_EXCEEDED, id,
                        "inheritance chain longer than " + maxDepth + "; base '" + base + "' dropped"));
                base = null;
            } else {
                resolve(base, path);
            }
        }
        path.pop();
        bases.put(id, Optional.ofNullable(base));
        StructuredLog.finer(LOG, "inheritance.edge", "schema", id, "base", base);
    }

    private String candidate(String id) {
        if (!(schemas.get(id) instanceof SchemaNode node)) {
            return null;
        }
        for (var ref : SchemaShapes.referenceParts(node)) {
            if (schemas.get(ref.id()) instanceof SchemaNode target && SchemaShapes.isAggregate(target)) {
                return ref.id();
            }
        }
        return null;
    }

    private static String describe(Deque<String> path, String closing) {
        final var sb = new StringBuilder();
        final var it = path.descendingIterator();
        while (it.hasNext()) {
            sb.append(it.next()).append(" -> ");
        }
        return sb.append(closing).toString();
    }

    private void report(Diagnostic diagnostic) {
        StructuredLog.warning(LOG, "diagnostic", "kind", diagnostic.kind(), "schema", diagnostic.schemaName(),
                "message", diagnostic.message());
        diagnostics.accept(diagnostic);
    }
}
