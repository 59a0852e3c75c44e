package io.github.simbo1905.json.openapi.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Output of one generation run: the ordered declarations, a name to kind index and
/// every diagnostic recorded along the way.
public record GenerationResult(List<Declaration> declarations, Map<String, Declaration.Kind> kinds,
                               List<Diagnostic> diagnostics) {

    public GenerationResult {
        Objects.requireNonNull(declarations, "declarations must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        declarations = List.copyOf(declarations);
        diagnostics = List.copyOf(diagnostics);
        final var index = new LinkedHashMap<String, Declaration.Kind>();
        for (var d : declarations) {
            if (index.put(d.name(), d.kind()) != null) {
                throw new IllegalArgumentException("duplicate declaration name: " + d.name());
            }
        }
        kinds = Collections.unmodifiableMap(index);
    }

    public GenerationResult(List<Declaration> declarations, List<Diagnostic> diagnostics) {
        this(declarations, Map.of(), diagnostics);
    }

    public Optional<Declaration> declaration(String name) {
        return declarations.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    public Optional<Declaration.Kind> kindOf(String name) {
        return Optional.ofNullable(kinds.get(name));
    }

    public <T extends Declaration> Optional<T> declaration(String name, Class<T> type) {
        return declaration(name).filter(type::isInstance).map(type::cast);
    }

    public List<Diagnostic> diagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
