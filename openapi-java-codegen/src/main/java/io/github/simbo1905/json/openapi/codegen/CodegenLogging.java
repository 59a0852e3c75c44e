package io.github.simbo1905.json.openapi.codegen;

import java.util.logging.Logger;

/// Centralized logger for the code generator.
/// Classes use it via:
///   import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;
final class CodegenLogging {
    static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.openapi.codegen");
    private CodegenLogging() {}
}
