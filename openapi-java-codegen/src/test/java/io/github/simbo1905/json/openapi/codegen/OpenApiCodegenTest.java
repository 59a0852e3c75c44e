package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.Declaration.Aggregate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class OpenApiCodegenTest extends CodegenTestBase {

    private static final String DOCUMENT = """
            openapi: 3.1.0
            components:
              schemas:
                Order:
                  type: object
                  required: [id]
                  properties:
                    id: {type: string, format: uuid}
                    status: {type: string, enum: [pending, shipped]}
                    total: {type: number, format: decimal, default: 12.5}
                    placedAt: {type: string, format: date-time, default: "2024-01-01T00:00:00Z"}
                User:
                  type: object
                  properties:
                    status: {type: string, enum: [active, inactive]}
            """;

    @Test
    void generatesFromText() {
        final var result = OpenApiCodegen.withDefaults().generateFromText(DOCUMENT);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.declarations()).extracting(Declaration::name)
                .containsExactly("Order", "User", "Status", "StatusLowercase");
        final var order = result.declaration("Order", Aggregate.class).orElseThrow();
        assertThat(order.member("Id").orElseThrow().type())
                .isEqualTo(new ResolvedType.Primitive(ResolvedType.PrimitiveKind.UUID));
        assertThat(order.member("Total").orElseThrow().defaultExpression().orElseThrow().source())
                .isEqualTo("new java.math.BigDecimal(\"12.5\")");
        assertThat(order.member("PlacedAt").orElseThrow().defaultExpression().orElseThrow().source())
                .isEqualTo("java.time.OffsetDateTime.parse(\"2024-01-01T00:00:00Z\")");
    }

    @Test
    void concurrentRunsAreIndependent() throws Exception {
        final var codegen = OpenApiCodegen.withDefaults();
        final var expected = codegen.renderFromText(DOCUMENT);

        final ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            final List<Callable<Object>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> codegen.renderFromText(DOCUMENT));
            }
            for (Future<Object> f : pool.invokeAll(tasks)) {
                assertThat(f.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
