package io.github.simbo1905.json.openapi.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.JsonType;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.Schema;
import io.github.simbo1905.json.openapi.codegen.SchemaAst.SchemaValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.json.openapi.codegen.SchemaAst.builder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/// Rendered defaults at the edges of their types must be accepted by javac and
/// evaluate to the schema value.
class LiteralCompilationTest extends CodegenTestBase {

    private static final String PACKAGE = "com.example.literals";

    @Test
    void edgeDefaultsCompileAndKeepTheirValues() throws Exception {
        assumeTrue(GeneratedSourceCompiler.available(), "no system compiler");

        final Map<String, Schema> schemas = new LinkedHashMap<>();
        schemas.put("Defaults", builder(JsonType.OBJECT)
                .property("minInt", builder(JsonType.INTEGER).format("int32")
                        .defaultValue(new SchemaAst.IntegerValue(BigInteger.valueOf(Integer.MIN_VALUE))).build())
                .property("minLong", builder(JsonType.INTEGER).format("int64")
                        .defaultValue(new SchemaAst.IntegerValue(BigInteger.valueOf(Long.MIN_VALUE))).build())
                .property("tiny", builder(JsonType.NUMBER).format("float")
                        .defaultValue(SchemaValue.of(new BigDecimal("1.5E-40"))).build())
                .property("big", builder(JsonType.NUMBER)
                        .defaultValue(SchemaValue.of(new BigDecimal("1.7976931348623157E308"))).build())
                .property("exact", builder(JsonType.NUMBER).format("decimal")
                        .defaultValue(SchemaValue.of(new BigDecimal("3.14159265358979323846"))).build())
                .property("text", builder(JsonType.STRING)
                        .defaultValue(SchemaValue.of("tab\there \"quoted\" \\ \u0001   end")).build())
                .property("unicodeEscapeLookalike", builder(JsonType.STRING)
                        .defaultValue(SchemaValue.of("\\u0022")).build())
                .property("flags", builder(JsonType.ARRAY).items(builder(JsonType.BOOLEAN).build())
                        .defaultValue(new SchemaAst.ArrayValue(List.of())).build())
                .build());

        final var codegen = new OpenApiCodegen(CodegenOptions.defaults().withPackageName(PACKAGE));
        final var loader = GeneratedSourceCompiler.compile(PACKAGE, codegen.render(codegen.generate(schemas)));
        final Object instance = loader.loadClass(PACKAGE + ".Defaults").getConstructor().newInstance();
        final JsonNode json = new ObjectMapper().valueToTree(instance);

        assertThat(json.get("minInt").intValue()).isEqualTo(Integer.MIN_VALUE);
        assertThat(json.get("minLong").longValue()).isEqualTo(Long.MIN_VALUE);
        assertThat(json.get("tiny").floatValue()).isEqualTo(1.5E-40f);
        assertThat(json.get("big").doubleValue()).isEqualTo(Double.MAX_VALUE);
        assertThat(json.get("exact").decimalValue()).isEqualByComparingTo("3.14159265358979323846");
        assertThat(json.get("text").textValue()).isEqualTo("tab\there \"quoted\" \\ \u0001   end");
        assertThat(json.get("unicodeEscapeLookalike").textValue()).isEqualTo("\\u0022");
        assertThat(json.get("flags").isArray()).isTrue();
        assertThat(json.get("flags")).isEmpty();
    }
}
