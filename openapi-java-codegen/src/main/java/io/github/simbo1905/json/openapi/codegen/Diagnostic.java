package io.github.simbo1905.json.openapi.codegen;

import java.util.Objects;

/// A non-fatal problem recorded during generation. The affected declaration is
/// degraded rather than dropped, and the run continues.
public record Diagnostic(Kind kind, String schemaName, String message) {

    public enum Kind {
        /// An `allOf`/base chain revisits a schema already on the resolution path.
        COMPOSITION_CYCLE,
        /// A discriminator mapping names a schema with no declaration.
        UNRESOLVED_DISCRIMINATOR_TARGET,
        /// A reference names a schema that is not in the input.
        UNRESOLVED_REFERENCE,
        /// Type resolution nested deeper than the configured limit.
        DEPTH_EXCEEDED
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(schemaName, "schemaName must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return kind + " [" + schemaName + "]: " + message;
    }
}
