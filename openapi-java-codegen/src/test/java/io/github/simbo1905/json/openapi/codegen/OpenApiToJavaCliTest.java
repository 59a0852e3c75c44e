package io.github.simbo1905.json.openapi.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenApiToJavaCliTest extends CodegenTestBase {

    @TempDir
    Path tempDir;

    private final StringWriter errors = new StringWriter();
    private final PrintWriter err = new PrintWriter(errors, true);

    @Test
    void writesSourcesIntoPackageDirectory() throws Exception {
        final var input = OpenApiSchemaReaderTest.resource("petstore.yaml").toString();

        final var written = OpenApiToJavaCli.run(new String[]{"--package", "com.acme.pets", input, tempDir.toString()}, err);

        final Path packageDir = tempDir.resolve("com/acme/pets");
        assertThat(written).contains(packageDir.resolve("Pet.java"), packageDir.resolve("Status.java"));
        assertThat(Files.readString(packageDir.resolve("Pet.java"), StandardCharsets.UTF_8))
                .contains("package com.acme.pets;");
        assertThat(errors.toString()).isEmpty();
    }

    @Test
    void optionsReachTheRenderer() throws Exception {
        final var input = OpenApiSchemaReaderTest.resource("petstore.yaml").toString();

        OpenApiToJavaCli.run(new String[]{"--camel-case", "--no-header", "--no-doc-comments",
                "--no-propagate-defaults", input, tempDir.toString()}, err);

        final String pet = Files.readString(tempDir.resolve("generated/models/Pet.java"), StandardCharsets.UTF_8);
        assertThat(pet).startsWith("package generated.models;")
                .contains("private String name;")
                .contains("public String getName() {")
                .contains("private Status status = null;")
                .doesNotContain("/**");
    }

    @Test
    void diagnosticsArePrintedAsWarnings() throws Exception {
        final Path doc = tempDir.resolve("broken.json");
        Files.writeString(doc, """
                {"components": {"schemas": {
                  "Holder": {"type": "object", "properties": {"ghost": {"$ref": "#/components/schemas/Ghost"}}}
                }}}
                """, StandardCharsets.UTF_8);

        final var written = OpenApiToJavaCli.run(new String[]{doc.toString(), tempDir.resolve("out").toString()}, err);

        assertThat(written).hasSize(1);
        assertThat(errors.toString()).startsWith("warning: UNRESOLVED_REFERENCE [Holder]")
                .contains("Ghost");
    }

    @Test
    void usageErrors() {
        assertThatThrownBy(() -> OpenApiToJavaCli.run(new String[0], err))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Missing input");
        assertThatThrownBy(() -> OpenApiToJavaCli.run(new String[]{"--bogus", "x.yaml"}, err))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Unknown option: --bogus");
        assertThatThrownBy(() -> OpenApiToJavaCli.run(new String[]{"--package"}, err))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("requires a value");
        assertThatThrownBy(() -> OpenApiToJavaCli.run(new String[]{"--max-depth", "deep", "x.yaml"}, err))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("expects an integer");
        assertThatThrownBy(() -> OpenApiToJavaCli.run(new String[]{tempDir.resolve("missing.yaml").toString()}, err))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("not found");
    }

    @Test
    void unreadableDocumentSurfacesReadException() throws Exception {
        final Path doc = tempDir.resolve("empty.yaml");
        Files.writeString(doc, "openapi: 3.0.0\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> OpenApiToJavaCli.run(new String[]{doc.toString(), tempDir.toString()}, err))
                .isInstanceOf(OpenApiReadException.class)
                .extracting(e -> ((OpenApiReadException) e).reason())
                .isEqualTo(OpenApiReadException.Reason.NO_SCHEMAS);
    }
}
