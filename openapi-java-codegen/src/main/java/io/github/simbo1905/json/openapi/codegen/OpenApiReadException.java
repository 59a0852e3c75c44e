package io.github.simbo1905.json.openapi.codegen;

import java.util.Objects;

/// Exception signalling that a schema document could not be read, with a typed reason
public final class OpenApiReadException extends RuntimeException {
    private final String location;
    private final Reason reason;

    OpenApiReadException(String location, Reason reason, String message) {
        super(message);
        this.location = Objects.requireNonNull(location, "location");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    OpenApiReadException(String location, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.location = Objects.requireNonNull(location, "location");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /// Pointer-style path of the offending element, e.g. `/components/schemas/Pet/properties/tag`.
    public String location() {
        return location;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        MALFORMED_DOCUMENT,
        NO_SCHEMAS,
        INVALID_SCHEMA
    }
}
