package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.ResolvedType.Mutability;

import java.util.Objects;
import java.util.Set;

/// Options constant for one generation run.
///
/// @param memberNaming             casing applied to member identifiers; type names are always PascalCase
/// @param arrayMutability          collection flavour for `array` schemas
/// @param mapMutability            map flavour for `additionalProperties` schemas
/// @param defaultSatisfiesRequired an optional member with a non-null default is treated as non-nullable
/// @param propagateDefaults        render defaults into member initializers; otherwise emit placeholders
/// @param reservedWords            identifiers that must be escaped
/// @param maxCompositionDepth      nesting limit for type resolution and base chains
/// @param packageName              package of rendered sources
/// @param docComments              render schema descriptions as Javadoc
/// @param fileHeader               render a generated-code header comment
public record CodegenOptions(
        NamingStyle memberNaming,
        Mutability arrayMutability,
        Mutability mapMutability,
        boolean defaultSatisfiesRequired,
        boolean propagateDefaults,
        Set<String> reservedWords,
        int maxCompositionDepth,
        String packageName,
        boolean docComments,
        boolean fileHeader
) {
    public enum NamingStyle {
        PASCAL_CASE, CAMEL_CASE
    }

    public static final Set<String> JAVA_RESERVED_WORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "yield", "record", "sealed", "permits", "_"
    );

    public CodegenOptions {
        Objects.requireNonNull(memberNaming, "memberNaming");
        Objects.requireNonNull(arrayMutability, "arrayMutability");
        Objects.requireNonNull(mapMutability, "mapMutability");
        Objects.requireNonNull(reservedWords, "reservedWords");
        Objects.requireNonNull(packageName, "packageName");
        reservedWords = Set.copyOf(reservedWords);
        if (maxCompositionDepth <= 0) {
            throw new IllegalArgumentException("maxCompositionDepth must be > 0");
        }
        if (packageName.isBlank()) {
            throw new IllegalArgumentException("packageName must not be blank");
        }
    }

    public static CodegenOptions defaults() {
        return new CodegenOptions(NamingStyle.PASCAL_CASE, Mutability.IMMUTABLE, Mutability.IMMUTABLE,
                true, true, JAVA_RESERVED_WORDS, 64, "generated.models", true, true);
    }

    public CodegenOptions withMemberNaming(NamingStyle style) {
        return new CodegenOptions(style, arrayMutability, mapMutability, defaultSatisfiesRequired,
                propagateDefaults, reservedWords, maxCompositionDepth, packageName, docComments, fileHeader);
    }

    public CodegenOptions withMutableCollections(boolean arrays, boolean maps) {
        return new CodegenOptions(memberNaming, arrays ? Mutability.MUTABLE : Mutability.IMMUTABLE,
                maps ? Mutability.MUTABLE : Mutability.IMMUTABLE, defaultSatisfiesRequired,
                propagateDefaults, reservedWords, maxCompositionDepth, packageName, docComments, fileHeader);
    }

    public CodegenOptions withDefaultSatisfiesRequired(boolean enabled) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, enabled,
                propagateDefaults, reservedWords, maxCompositionDepth, packageName, docComments, fileHeader);
    }

    public CodegenOptions withPropagateDefaults(boolean enabled) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, defaultSatisfiesRequired,
                enabled, reservedWords, maxCompositionDepth, packageName, docComments, fileHeader);
    }

    public CodegenOptions withReservedWords(Set<String> words) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, defaultSatisfiesRequired,
                propagateDefaults, words, maxCompositionDepth, packageName, docComments, fileHeader);
    }

    public CodegenOptions withMaxCompositionDepth(int depth) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, defaultSatisfiesRequired,
                propagateDefaults, reservedWords, depth, packageName, docComments, fileHeader);
    }

    public CodegenOptions withPackageName(String name) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, defaultSatisfiesRequired,
                propagateDefaults, reservedWords, maxCompositionDepth, name, docComments, fileHeader);
    }

    public CodegenOptions withDocComments(boolean enabled) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, defaultSatisfiesRequired,
                propagateDefaults, reservedWords, maxCompositionDepth, packageName, enabled, fileHeader);
    }

    public CodegenOptions withFileHeader(boolean enabled) {
        return new CodegenOptions(memberNaming, arrayMutability, mapMutability, defaultSatisfiesRequired,
                propagateDefaults, reservedWords, maxCompositionDepth, packageName, docComments, enabled);
    }
}
