package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.Declaration.Aggregate;
import io.github.simbo1905.json.openapi.codegen.Declaration.EnumMember;
import io.github.simbo1905.json.openapi.codegen.Declaration.Enumeration;
import io.github.simbo1905.json.openapi.codegen.Declaration.ExtensionData;
import io.github.simbo1905.json.openapi.codegen.Declaration.Member;
import io.github.simbo1905.json.openapi.codegen.Declaration.TypeAlias;
import io.github.simbo1905.json.openapi.codegen.Declaration.Union;
import io.github.simbo1905.json.openapi.codegen.Declaration.UnionVariant;
import io.github.simbo1905.json.openapi.codegen.NameRegistry.IdentifierRole;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaNode;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaRef;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Builds the declaration set for a schema map in two passes.
///
/// Pass 1 classifies every top-level schema, names it, and collects the inline
/// enumerations and inline objects that need declarations of their own. Pass 2
/// assembles enumerations, aggregates (bases before subtypes), unions and aliases.
///
/// The synthesizer itself is stateless; each [#synthesize] call works on fresh state.
public final class DeclarationSynthesizer {

    /// Raw name of the catch-all member of aggregates with open additional properties.
    static final String EXTENSION_MEMBER = "AdditionalProperties";

    private final CodegenOptions options;

    public DeclarationSynthesizer(CodegenOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public GenerationResult synthesize(Map<String, Schema> schemas) {
        return synthesize(schemas, new NameRegistry(options));
    }

    /// Runs with a caller-supplied registry, which may already hold reserved names.
    GenerationResult synthesize(Map<String, Schema> schemas, NameRegistry registry) {
        Objects.requireNonNull(schemas, "schemas must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        return new Run(schemas, registry).execute();
    }

    private final class Run implements TypeResolver.NameLookup {
        private final Map<String, Schema> schemas;
        private final NameRegistry registry;
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private final Map<String, Declaration.Kind> classification = new LinkedHashMap<>();
        private final Map<String, String> topLevelNames = new LinkedHashMap<>();
        private final Map<SchemaNode, String> inlineNames = new IdentityHashMap<>();
        private final Map<String, Enumeration> enumerations = new HashMap<>();
        private final Map<String, Aggregate> aggregates = new HashMap<>();

        private final TypeResolver resolver;
        private final LiteralRenderer literals;
        private final InheritanceGraph inheritance;

        private List<InlineDeclarationCollector.EnumGroup> enumGroups = List.of();
        private List<InlineDeclarationCollector.InlineObject> inlineObjects = List.of();

        Run(Map<String, Schema> schemas, NameRegistry registry) {
            this.schemas = new LinkedHashMap<>(schemas);
            this.registry = registry;
            this.resolver = new TypeResolver(options, this, diagnostics::add);
            this.literals = new LiteralRenderer(this::enumeration);
            this.inheritance = new InheritanceGraph(this.schemas, options.maxCompositionDepth(), diagnostics::add);
        }

        GenerationResult execute() {
            classifyAndName();
            collectInlineDeclarations();

            final Map<String, Declaration> byId = new HashMap<>();
            for (var entry : schemas.entrySet()) {
                if (classification.get(entry.getKey()) == Declaration.Kind.ENUMERATION) {
                    final var node = (SchemaNode) entry.getValue();
                    byId.put(entry.getKey(), enumeration(topLevelNames.get(entry.getKey()), node,
                            SchemaShapes.enumLiterals(node)));
                }
            }
            final var inlineEnums = new ArrayList<Declaration>();
            for (var group : enumGroups) {
                inlineEnums.add(enumeration(inlineNames.get(group.first()), group.first(), group.literals()));
            }

            for (var id : schemas.keySet()) {
                if (classification.get(id) == Declaration.Kind.AGGREGATE) {
                    byId.put(id, aggregate(id));
                }
            }
            final var inlineAggregates = new ArrayList<Declaration>();
            for (var inline : inlineObjects) {
                final String name = inlineNames.get(inline.node());
                final var built = assemble(name, null, List.of(inline.node()), List.of());
                aggregates.put(name, built);
                inlineAggregates.add(built);
            }

            for (var entry : schemas.entrySet()) {
                final String id = entry.getKey();
                final String name = topLevelNames.get(id);
                switch (classification.get(id)) {
                    case UNION -> byId.put(id, union(id, name, (SchemaNode) entry.getValue()));
                    case TYPE_ALIAS -> byId.put(id, new TypeAlias(name,
                            resolver.resolveUnderlying(name, entry.getValue()), description(entry.getValue())));
                    default -> {
                    }
                }
            }

            final var declarations = new ArrayList<Declaration>();
            for (var id : schemas.keySet()) {
                declarations.add(byId.get(id));
            }
            declarations.addAll(inlineEnums);
            declarations.addAll(inlineAggregates);

            StructuredLog.fine(LOG, "synthesis.done", "schemas", schemas.size(), "declarations", declarations.size(),
                    "diagnostics", diagnostics.size());
            return new GenerationResult(declarations, diagnostics);
        }

        // --------------------------------------------------------------
        // Pass 1
        // --------------------------------------------------------------

        private void classifyAndName() {
            for (var entry : schemas.entrySet()) {
                classification.put(entry.getKey(), classify(entry.getValue()));
            }
            final var ids = new ArrayList<>(schemas.keySet());
            final var names = registry.assign(NameRegistry.TYPE_SCOPE, ids, IdentifierRole.TYPE);
            for (int i = 0; i < ids.size(); i++) {
                topLevelNames.put(ids.get(i), names.get(i));
                StructuredLog.finer(LOG, "classify", "schema", ids.get(i), "name", names.get(i),
                        "kind", classification.get(ids.get(i)));
            }
        }

        private Declaration.Kind classify(Schema schema) {
            if (!(schema instanceof SchemaNode node)) {
                return Declaration.Kind.TYPE_ALIAS;
            }
            if (SchemaShapes.isEnumeration(node)) return Declaration.Kind.ENUMERATION;
            if (SchemaShapes.isUnion(node)) return Declaration.Kind.UNION;
            if (SchemaShapes.isAggregate(node)) return Declaration.Kind.AGGREGATE;
            return Declaration.Kind.TYPE_ALIAS;
        }

        private void collectInlineDeclarations() {
            final var collector = new InlineDeclarationCollector();
            for (var entry : schemas.entrySet()) {
                if (!(entry.getValue() instanceof SchemaNode node)) continue;
                switch (classification.get(entry.getKey())) {
                    case AGGREGATE -> collector.collectAggregate(entry.getKey(), node);
                    case TYPE_ALIAS -> collector.collectAlias(entry.getKey(), node);
                    default -> {
                    }
                }
            }

            enumGroups = collector.enumGroups();
            final var enumNames = registry.assign(NameRegistry.TYPE_SCOPE,
                    enumGroups.stream().map(InlineDeclarationCollector.EnumGroup::propertyName).toList(),
                    IdentifierRole.TYPE);
            for (int i = 0; i < enumGroups.size(); i++) {
                for (var node : enumGroups.get(i).nodes()) {
                    inlineNames.put(node, enumNames.get(i));
                }
            }

            inlineObjects = collector.inlineObjects();
            final var objectNames = registry.assign(NameRegistry.TYPE_SCOPE,
                    inlineObjects.stream().map(InlineDeclarationCollector.InlineObject::rawName).toList(),
                    IdentifierRole.TYPE);
            for (int i = 0; i < inlineObjects.size(); i++) {
                inlineNames.put(inlineObjects.get(i).node(), objectNames.get(i));
            }
            StructuredLog.fine(LOG, "collect.done", "inlineEnums", enumGroups.size(),
                    "inlineObjects", inlineObjects.size());
        }

        // --------------------------------------------------------------
        // Pass 2
        // --------------------------------------------------------------

        private Enumeration enumeration(String name, SchemaNode node, List<SchemaValue> values) {
            final var memberNames = registry.assign("enum:" + name,
                    values.stream().map(SchemaValue::literalText).toList(), IdentifierRole.ENUM_MEMBER);
            final var members = new ArrayList<EnumMember>(values.size());
            for (int i = 0; i < values.size(); i++) {
                members.add(new EnumMember(memberNames.get(i), values.get(i)));
            }
            final var built = new Enumeration(name, SchemaShapes.enumBase(node), members, node.description());
            enumerations.put(name, built);
            return built;
        }

        /// Builds the aggregate for a top-level id, building its base first.
        private Aggregate aggregate(String id) {
            final String name = topLevelNames.get(id);
            final var existing = aggregates.get(name);
            if (existing != null) {
                return existing;
            }
            final var node = (SchemaNode) schemas.get(id);
            final Optional<String> baseId = inheritance.baseOf(id);
            final var ancestors = new ArrayList<Aggregate>();
            for (var ancestorId : inheritance.ancestors(id)) {
                ancestors.add(aggregate(ancestorId));
            }

            final var sources = new ArrayList<SchemaNode>();
            sources.add(node);
            sources.addAll(SchemaShapes.inlineParts(node));
            for (var ref : inheritance.flattenedReferences(id)) {
                final Schema target = schemas.get(ref.id());
                if (target instanceof SchemaNode t && classification.get(ref.id()) == Declaration.Kind.AGGREGATE) {
                    sources.add(t);
                    sources.addAll(SchemaShapes.inlineParts(t));
                    StructuredLog.finer(LOG, "aggregate.flatten", "schema", id, "ref", ref.id());
                } else if (target == null) {
                    report(new Diagnostic(Diagnostic.Kind.UNRESOLVED_REFERENCE, id,
                            "allOf reference to unknown schema '" + ref.id() + "' ignored"));
                }
            }

            final var built = assemble(name, baseId.map(topLevelNames::get).orElse(null), sources, ancestors);
            aggregates.put(name, built);
            return built;
        }

        private Aggregate assemble(String name, String baseName, List<SchemaNode> sources, List<Aggregate> ancestors) {
            final Set<String> inheritedKeys = new HashSet<>();
            boolean inheritedExtension = false;
            final String scope = "members:" + name;
            for (var ancestor : ancestors) {
                for (var m : ancestor.members()) {
                    inheritedKeys.add(m.jsonName());
                    registry.reserve(scope, m.name(), m.jsonName());
                }
                if (ancestor.extensionData() != null) {
                    inheritedExtension = true;
                    registry.reserve(scope, ancestor.extensionData().name(), EXTENSION_MEMBER);
                }
            }

            final Map<String, Schema> properties = new LinkedHashMap<>();
            final Set<String> required = new LinkedHashSet<>();
            Schema additional = null;
            for (var source : sources) {
                source.properties().forEach((key, schema) -> {
                    if (inheritedKeys.contains(key)) {
                        StructuredLog.finer(LOG, "aggregate.omitInherited", "aggregate", name, "key", key);
                    } else {
                        properties.putIfAbsent(key, schema);
                    }
                });
                required.addAll(source.required());
                if (additional == null) additional = source.additionalProperties();
            }
            final boolean extension = additional != null && !inheritedExtension;

            final var raws = new ArrayList<>(properties.keySet());
            if (extension) raws.add(EXTENSION_MEMBER);
            final var names = registry.assign(scope, raws, IdentifierRole.MEMBER);

            final var members = new ArrayList<Member>(properties.size());
            int i = 0;
            for (var entry : properties.entrySet()) {
                final String key = entry.getKey();
                final Schema schema = entry.getValue();
                final boolean mandatory = required.contains(key);
                final ResolvedType type = resolver.resolve(name, schema, mandatory);
                final LiteralExpression defaultValue = schema instanceof SchemaNode n ? defaultFor(n, type) : null;
                members.add(new Member(names.get(i++), type, mandatory, defaultValue, key, description(schema)));
            }
            final ExtensionData extensionData = extension
                    ? new ExtensionData(names.get(i), resolver.resolveUnderlying(name, additional))
                    : null;

            final String description = sources.isEmpty() ? null : sources.get(0).description();
            StructuredLog.finer(LOG, "aggregate.built", "name", name, "base", baseName, "members", members.size(),
                    "extension", extension);
            return new Aggregate(name, baseName, members, extensionData, description);
        }

        private LiteralExpression defaultFor(SchemaNode node, ResolvedType type) {
            if (node.defaultValue() == null) {
                return null;
            }
            final var rendered = literals.render(node.defaultValue(), type, node.format());
            if (rendered.isEmpty()) {
                return null;
            }
            return options.propagateDefaults() ? rendered.get() : new LiteralExpression.Placeholder();
        }

        private Union union(String id, String name, SchemaNode node) {
            final var discriminator = node.discriminator();
            final Map<String, UnionVariant> variants = new LinkedHashMap<>();
            final Set<String> dangling = new HashSet<>();
            if (discriminator != null) {
                discriminator.mapping().forEach((value, ref) -> {
                    final String target = topLevelNames.get(ref.id());
                    if (target == null) {
                        dangling.add(ref.id());
                        report(new Diagnostic(Diagnostic.Kind.UNRESOLVED_DISCRIMINATOR_TARGET, id,
                                "mapping '" + value + "' targets unknown schema '" + ref.id() + "'; variant dropped"));
                    } else {
                        variants.merge(target, new UnionVariant(target, value),
                                (first, ignored) -> first.withAlias(value));
                    }
                });
            }
            for (var alternative : SchemaShapes.alternatives(node)) {
                if (!(alternative instanceof SchemaRef ref)) {
                    StructuredLog.finer(LOG, "union.inlineAlternative", "union", id);
                    continue;
                }
                final String target = topLevelNames.get(ref.id());
                if (target == null) {
                    if (!dangling.contains(ref.id())) {
                        report(new Diagnostic(Diagnostic.Kind.UNRESOLVED_REFERENCE, id,
                                "alternative '" + ref.id() + "' is not a known schema; variant dropped"));
                    }
                    continue;
                }
                variants.putIfAbsent(target, new UnionVariant(target, null));
            }
            return new Union(name, discriminator == null,
                    discriminator == null ? null : discriminator.propertyName(),
                    new ArrayList<>(variants.values()), node.description());
        }

        private String description(Schema schema) {
            return schema instanceof SchemaNode n ? n.description() : null;
        }

        private void report(Diagnostic diagnostic) {
            StructuredLog.warning(LOG, "diagnostic", "kind", diagnostic.kind(), "schema", diagnostic.schemaName(),
                    "message", diagnostic.message());
            diagnostics.add(diagnostic);
        }

        // --------------------------------------------------------------
        // Name lookup for the resolver
        // --------------------------------------------------------------

        @Override
        public Optional<String> declarationName(String schemaId) {
            return Optional.ofNullable(topLevelNames.get(schemaId));
        }

        @Override
        public Optional<String> inlineDeclaration(SchemaNode node) {
            return Optional.ofNullable(inlineNames.get(node));
        }

        @Override
        public boolean isUntaggedUnion(String schemaId) {
            return classification.get(schemaId) == Declaration.Kind.UNION
                    && ((SchemaNode) schemas.get(schemaId)).discriminator() == null;
        }

        @Override
        public Optional<Enumeration> enumeration(String declarationName) {
            return Optional.ofNullable(enumerations.get(declarationName));
        }
    }
}
