package io.github.simbo1905.json.openapi.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for codegen tests.
/// - Emits an INFO banner per test.
/// - Provides small schema-building helpers.
public class CodegenTestBase extends OpenApiCodegenLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.openapi.codegen.test");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static SchemaAst.SchemaNode string() {
        return SchemaAst.builder(SchemaAst.JsonType.STRING).build();
    }

    static SchemaAst.SchemaNode integer() {
        return SchemaAst.builder(SchemaAst.JsonType.INTEGER).build();
    }

    static SchemaAst.SchemaNode stringEnum(String... values) {
        return SchemaAst.builder(SchemaAst.JsonType.STRING).enumStrings(values).build();
    }
}
