package io.github.simbo1905.json.openapi.codegen;

import java.util.Objects;

/// Collision resolution found no free identifier for a raw name. Fatal for the run:
/// emitting a duplicate name would produce invalid output.
public final class NameExhaustionException extends RuntimeException {
    private final String rawName;
    private final String canonicalName;

    NameExhaustionException(String rawName, String canonicalName) {
        super("No free identifier for '" + rawName + "' (canonical '" + canonicalName + "')");
        this.rawName = Objects.requireNonNull(rawName, "rawName");
        this.canonicalName = Objects.requireNonNull(canonicalName, "canonicalName");
    }

    public String rawName() {
        return rawName;
    }

    public String canonicalName() {
        return canonicalName;
    }
}
