package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Entry point for generating Java declarations from OpenAPI schemas.
///
/// Each call is an independent run with its own name registry and diagnostics, so one
/// instance can be shared between threads.
///
/// ```java
/// var codegen = new OpenApiCodegen(CodegenOptions.defaults().withPackageName("com.example.api"));
/// GenerationResult result = codegen.generateFromFile(Path.of("petstore.yaml"));
/// Map<String, String> sources = codegen.render(result);
/// ```
public final class OpenApiCodegen {
    private final CodegenOptions options;

    public OpenApiCodegen(CodegenOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public static OpenApiCodegen withDefaults() {
        return new OpenApiCodegen(CodegenOptions.defaults());
    }

    public CodegenOptions options() {
        return options;
    }

    /// Synthesizes declarations for an ordered schema map.
    public GenerationResult generate(Map<String, Schema> schemas) {
        Objects.requireNonNull(schemas, "schemas must not be null");
        LOG.fine(() -> "Generating declarations for " + schemas.size() + " schemas");
        final var result = new DeclarationSynthesizer(options).synthesize(schemas);
        if (!result.diagnostics().isEmpty()) {
            LOG.info(() -> "Generation finished with " + result.diagnostics().size() + " diagnostic(s)");
        }
        return result;
    }

    /// Reads a JSON or YAML document and synthesizes its `components/schemas`.
    public GenerationResult generateFromText(String document) {
        return generate(OpenApiSchemaReader.read(document));
    }

    public GenerationResult generateFromFile(Path file) throws IOException {
        return generate(OpenApiSchemaReader.read(file));
    }

    /// @return file name to Java source, in declaration order
    public Map<String, String> render(GenerationResult result) {
        return JavaSourceRenderer.render(result, options);
    }

    public Map<String, String> renderFromText(String document) {
        return render(generateFromText(document));
    }
}
