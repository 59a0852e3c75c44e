package io.github.simbo1905.json.openapi.codegen;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// CLI entry point for generating Java model sources from an OpenAPI document.
///
/// Usage:
/// `java -jar openapi-java-codegen.jar [options] <openapi.(json|yaml)> [outputDir]`
///
/// Sources are written under `outputDir` (default `.`) in the directory of the target
/// package. Diagnostics go to standard error; the exit code is 2 for usage or input
/// errors and 1 for anything unexpected.
public final class OpenApiToJavaCli {
    private OpenApiToJavaCli() {}

    static final String USAGE = String.join("\n",
            "Usage: java -jar openapi-java-codegen.jar [options] <openapi.(json|yaml)> [outputDir]",
            "Options:",
            "  --package <name>         target package (default generated.models)",
            "  --camel-case             camelCase member names instead of PascalCase",
            "  --mutable-collections    ArrayList/HashMap style collections for arrays and maps",
            "  --no-propagate-defaults  emit placeholders instead of schema defaults",
            "  --default-not-required   optional members stay nullable even with a default",
            "  --max-depth <n>          composition depth limit (default 64)",
            "  --no-doc-comments        omit Javadoc from schema descriptions",
            "  --no-header              omit the generated-code header");

    public static void main(String[] args) {
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        try {
            final var written = run(args, err);
            written.forEach(p -> System.out.println(p.toAbsolutePath()));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            System.exit(2);
        } catch (OpenApiReadException e) {
            err.println(e.reason() + " at " + e.location() + ": " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace(err);
            System.exit(1);
        }
    }

    static List<Path> run(String[] args, PrintWriter err) throws IOException {
        Objects.requireNonNull(err, "err must not be null");
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("Missing input document");
        }

        var options = CodegenOptions.defaults();
        final var positional = new ArrayList<String>();
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "--package" -> options = options.withPackageName(requireValue(args, ++i, arg));
                case "--camel-case" -> options = options.withMemberNaming(CodegenOptions.NamingStyle.CAMEL_CASE);
                case "--mutable-collections" -> options = options.withMutableCollections(true, true);
                case "--no-propagate-defaults" -> options = options.withPropagateDefaults(false);
                case "--default-not-required" -> options = options.withDefaultSatisfiesRequired(false);
                case "--max-depth" -> {
                    final String value = requireValue(args, ++i, arg);
                    try {
                        options = options.withMaxCompositionDepth(Integer.parseInt(value));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--max-depth expects an integer, got '" + value + "'", e);
                    }
                }
                case "--no-doc-comments" -> options = options.withDocComments(false);
                case "--no-header" -> options = options.withFileHeader(false);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            throw new IllegalArgumentException("Expected <input> [outputDir], got " + positional);
        }
        final Path input = Path.of(positional.get(0));
        final Path outputDir = Path.of(positional.size() == 2 ? positional.get(1) : ".");
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input document not found: " + input);
        }
        return generate(input, outputDir, options, err);
    }

    static List<Path> generate(Path input, Path outputDir, CodegenOptions options, PrintWriter err) throws IOException {
        final var codegen = new OpenApiCodegen(options);
        final var result = codegen.generateFromFile(input);
        for (var d : result.diagnostics()) {
            err.println("warning: " + d);
        }

        final Path packageDir = outputDir.resolve(options.packageName().replace('.', '/'));
        Files.createDirectories(packageDir);
        final var written = new ArrayList<Path>();
        for (var e : codegen.render(result).entrySet()) {
            final Path out = packageDir.resolve(e.getKey());
            Files.writeString(out, e.getValue(), StandardCharsets.UTF_8);
            written.add(out);
        }
        return written;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
